package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberDescriptor;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.Names;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 外部实现登记器：在类型声明之前收集原生替身，键与类型成员表的修饰名一致。
 */
public final class ExternalsBuilder {

    private final TypeSystem system;
    private final LoadUnit unit;
    private final String typeName;
    private final Map<String, ExternalsRegistry.Entry> entries;

    ExternalsBuilder(TypeSystem system, LoadUnit unit, String typeName, Map<String, ExternalsRegistry.Entry> entries) {
        this.system = system;
        this.unit = unit;
        this.typeName = typeName;
        this.entries = entries;
    }

    public LoadUnit getLoadUnit() {
        return unit;
    }

    public String getTypeName() {
        return typeName;
    }

    public TypeRef typeRef(String name, TypeReference... genericArguments) {
        return unit.typeRef(name, genericArguments);
    }

    /** 目标类型的具名泛型参数（与类型自身声明的参数身份一致） */
    public GenericParameter genericParameter(String name) {
        return new GenericParameter(name, typeName, unit);
    }

    public MethodSignature signature(Object returnType, Object... argumentTypes) {
        return system.signature(unit, typeName, null, returnType, argumentTypes);
    }

    public MethodSignature genericSignature(List<String> genericParameterNames, Object returnType,
                                            Object... argumentTypes) {
        return system.signature(unit, typeName, genericParameterNames, returnType, argumentTypes);
    }

    public ExternalsBuilder method(MemberFlags flags, String name, MethodSignature signature, Invokable body) {
        MemberDescriptor descriptor = new MemberDescriptor(name, flags);
        String key = signature.key(descriptor.getEscapedName());
        entries.put(ExternalsRegistry.entryKey(flags.isStatic(), key),
                new ExternalsRegistry.Entry(flags.isStatic(), key, descriptor, signature, body));
        return this;
    }

    public ExternalsBuilder rawMethod(boolean isStatic, String name, Invokable body) {
        String key = Names.escape(name);
        entries.put(ExternalsRegistry.entryKey(isStatic, key),
                new ExternalsRegistry.Entry(isStatic, key, null, null, body));
        return this;
    }

    @Override
    public String toString() {
        return "<Externals " + typeName + " " + Arrays.toString(entries.keySet().toArray()) + ">";
    }
}
