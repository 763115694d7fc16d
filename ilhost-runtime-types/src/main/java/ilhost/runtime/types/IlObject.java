package ilhost.runtime.types;

import ilhost.runtime.GenericInvokable;
import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行时实例：自有字段 + 指向类型实例模板的引用。
 *
 * <p>读取未写过的字段时回落到模板上的默认值；方法总是从模板查找。</p>
 */
public class IlObject {

    private final MemberTable template;
    private final Map<String, Object> fields = Collections.synchronizedMap(new LinkedHashMap<>());

    public IlObject(MemberTable template) {
        this.template = template;
    }

    /** 模板无所属类型（匿名模板）时为 null */
    public TypeDescriptor getType() {
        return template.getOwner();
    }

    public MemberTable getTemplate() {
        return template;
    }

    public Object get(String name) {
        String key = Names.escape(name);
        synchronized (fields) {
            if (fields.containsKey(key)) return fields.get(key);
        }
        Object value = template.lookup(key);
        if (value instanceof PropertyAccessor) {
            return ((PropertyAccessor) value).get(this, template);
        }
        return value;
    }

    public void set(String name, Object value) {
        String key = Names.escape(name);
        Object slot = template.lookup(key);
        if (slot instanceof PropertyAccessor) {
            ((PropertyAccessor) slot).set(this, template, value);
        } else {
            fields.put(key, value);
        }
    }

    public boolean hasOwnField(String name) {
        return fields.containsKey(Names.escape(name));
    }

    public Map<String, Object> getFields() {
        synchronized (fields) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /** 按名称调用实例成员（方法组或单一实现） */
    public Object invoke(String name, Object... args) {
        Object member = template.lookup(Names.escape(name));
        if (!(member instanceof Invokable)) {
            throw new IlHostException("Member '" + name + "' of type '" + describeType() + "' is not callable");
        }
        return ((Invokable) member).invoke(this, args);
    }

    /** 调用泛型方法：先绑定泛型实参再以实参调用 */
    public Object invokeGeneric(String name, Object[] genericArguments, Object... args) {
        Object member = template.lookup(Names.escape(name));
        if (!(member instanceof GenericInvokable)) {
            throw new IlHostException("Member '" + name + "' of type '" + describeType() + "' is not a generic method");
        }
        return ((GenericInvokable) member).bindGenericArguments(this, genericArguments).invoke(this, args);
    }

    /** 浅复制自有字段，共享模板 */
    public IlObject memberwiseClone() {
        IlObject copy = new IlObject(template);
        synchronized (fields) {
            copy.fields.putAll(fields);
        }
        return copy;
    }

    private String describeType() {
        TypeDescriptor type = getType();
        return type == null ? template.getLabel() : type.getFullName();
    }

    @Override
    public String toString() {
        return describeType();
    }
}
