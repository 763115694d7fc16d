package ilhost.runtime.types;

import ilhost.runtime.GenericInvokable;
import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;

import java.util.Arrays;

/**
 * 类型对外暴露的静态面：静态成员、实例模板、构造与泛型闭包入口。
 */
public final class PublicInterface {

    private final TypeDescriptor type;
    private final MemberTable statics;
    private final MemberTable template;

    public PublicInterface(TypeDescriptor type, MemberTable staticsParent, MemberTable templateParent) {
        this.type = type;
        this.statics = new MemberTable(type.getFullName() + " (static)", type, staticsParent);
        this.template = new MemberTable(type.getFullName(), type, templateParent);
    }

    public TypeDescriptor getType() {
        return type;
    }

    public MemberTable getStatics() {
        return statics;
    }

    /** 实例模板，实例查找成员时从这里开始 */
    public MemberTable getTemplate() {
        return template;
    }

    // ============ 静态成员 ============

    public Object invoke(String name, Object... args) {
        Object member = statics.lookup(Names.escape(name));
        if (!(member instanceof Invokable)) {
            throw new IlHostException("Static member '" + name + "' of type '" + type.getFullName()
                    + "' is not callable");
        }
        return ((Invokable) member).invoke(this, args);
    }

    public Object invokeGeneric(String name, Object[] genericArguments, Object... args) {
        Object member = statics.lookup(Names.escape(name));
        if (!(member instanceof GenericInvokable)) {
            throw new IlHostException("Static member '" + name + "' of type '" + type.getFullName()
                    + "' is not a generic method");
        }
        return ((GenericInvokable) member).bindGenericArguments(this, genericArguments).invoke(this, args);
    }

    public Object get(String name) {
        Object value = statics.lookup(Names.escape(name));
        if (value instanceof PropertyAccessor) {
            return ((PropertyAccessor) value).get(this, statics);
        }
        return value;
    }

    public void set(String name, Object value) {
        String key = Names.escape(name);
        Object existing = statics.lookup(key);
        if (existing instanceof PropertyAccessor) {
            ((PropertyAccessor) existing).set(this, statics, value);
        } else {
            statics.define(key, value);
        }
    }

    // ============ 构造与闭包 ============

    public IlObject construct(Object... args) {
        return type.getRuntime().construct(type, args);
    }

    /** 闭包并初始化 */
    public PublicInterface of(Object... typeArguments) {
        return type.getRuntime().close(type, Arrays.asList(typeArguments), true).getPublicInterface();
    }

    /** 闭包但不初始化 */
    public PublicInterface ofNoInitialize(Object... typeArguments) {
        return type.getRuntime().close(type, Arrays.asList(typeArguments), false).getPublicInterface();
    }

    @Override
    public String toString() {
        return type.getFullName();
    }
}
