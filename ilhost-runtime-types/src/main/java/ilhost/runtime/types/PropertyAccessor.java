package ilhost.runtime.types;

import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;

/**
 * 属性槽：读写时转发到同一成员表链上的 get_/set_ 访问器。
 */
public final class PropertyAccessor {

    private static final Object[] NO_ARGS = new Object[0];

    private final String name;
    private final String getterKey;
    private final String setterKey;

    public PropertyAccessor(String name, String getterKey, String setterKey) {
        this.name = name;
        this.getterKey = getterKey;
        this.setterKey = setterKey;
    }

    public String getName() {
        return name;
    }

    public String getGetterKey() {
        return getterKey;
    }

    public String getSetterKey() {
        return setterKey;
    }

    public Object get(Object self, MemberTable table) {
        Object getter = table.lookup(getterKey);
        if (!(getter instanceof Invokable)) {
            throw new IlHostException("Property '" + name + "' has no getter");
        }
        return ((Invokable) getter).invoke(self, NO_ARGS);
    }

    public void set(Object self, MemberTable table, Object value) {
        Object setter = table.lookup(setterKey);
        if (!(setter instanceof Invokable)) {
            throw new IlHostException("Property '" + name + "' has no setter");
        }
        ((Invokable) setter).invoke(self, new Object[]{value});
    }
}
