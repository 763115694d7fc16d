package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.AmbiguousMatchException;
import ilhost.runtime.types.FieldRecord;
import ilhost.runtime.types.MemberKind;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.PropertyRecord;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeReference;
import ilhost.runtime.typesystem.MemberHiding;
import ilhost.runtime.typesystem.ResolvedMethod;
import ilhost.runtime.typesystem.TypeSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 类型的反射视图。成员列表首次查询时生成并缓存，派生类型的成员在前。
 *
 * <p>过滤规则：只给 PUBLIC 时排除非公开成员，只给 NON_PUBLIC 时排除公开成员；
 * STATIC 与 INSTANCE 同理；基类的静态成员不参与；构造器只由 {@link #getConstructors} 返回。</p>
 */
public final class TypeInfo {

    private final TypeSystem system;
    private final TypeDescriptor type;
    private volatile List<MemberInfo> members;

    TypeInfo(TypeSystem system, TypeDescriptor type) {
        this.system = system;
        this.type = type;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public String getName() {
        return type.getShortName();
    }

    public String getFullName() {
        return type.getFullName();
    }

    /** 程序集限定名 */
    public String getAssemblyQualifiedName() {
        return type.getFullName() + ", " + type.getContext().getName();
    }

    public TypeInfo getBaseType() {
        return type.getBaseType() == null ? null : system.reflect(type.getBaseType());
    }

    public List<TypeInfo> getInterfaces() {
        List<TypeInfo> result = new ArrayList<>();
        for (TypeReference reference : type.getInterfaces()) {
            TypeDescriptor iface = system.resolveType(reference, type);
            if (iface != null) result.add(system.reflect(iface));
        }
        return result;
    }

    public boolean isInterface() { return type.isInterface(); }
    public boolean isEnum() { return type.isEnum(); }
    public boolean isArray() { return type.isArray(); }
    public boolean isValueType() { return type.isValueType(); }
    public boolean isClass() { return type.getKind() == TypeKind.CLASS || type.getKind() == TypeKind.STATIC_CLASS; }
    public boolean isGenericTypeDefinition() { return type.isGenericDefinition(); }
    public boolean isGenericType() { return !type.getGenericParameters().isEmpty(); }

    public TypeInfo getGenericTypeDefinition() {
        if (type.isGenericDefinition()) return this;
        return type.getOpenType() == null ? null : system.reflect(type.getOpenType());
    }

    public TypeInfo getElementType() {
        return type.getElementType() == null ? null : system.reflect(type.getElementType());
    }

    /** other 的实例能否赋给本类型 */
    public boolean isAssignableFrom(TypeInfo other) {
        return other != null && system.isAssignable(other.type, type);
    }

    public boolean isInstanceOfType(Object value) {
        return system.checkType(value, type);
    }

    public TypeInfo makeGenericType(Object... typeArguments) {
        return system.reflect(system.close(type, typeArguments));
    }

    public TypeInfo makeArrayType() {
        return system.reflect(system.arrayOf(type));
    }

    // ============ 成员 ============

    public List<MemberInfo> getMembers() {
        return getMembers(BindingFlag.defaults());
    }

    public List<MemberInfo> getMembers(Set<BindingFlag> flags) {
        return filter(MemberInfo.class, flags, null);
    }

    public List<MethodInfo> getMethods() {
        return getMethods(BindingFlag.defaults());
    }

    public List<MethodInfo> getMethods(Set<BindingFlag> flags) {
        return filter(MethodInfo.class, flags, null);
    }

    public List<FieldInfo> getFields() {
        return getFields(BindingFlag.defaults());
    }

    public List<FieldInfo> getFields(Set<BindingFlag> flags) {
        return filter(FieldInfo.class, flags, null);
    }

    public FieldInfo getField(String name) {
        List<FieldInfo> fields = filter(FieldInfo.class, BindingFlag.defaults(), name);
        return fields.isEmpty() ? null : fields.get(0);
    }

    public List<PropertyInfo> getProperties() {
        return getProperties(BindingFlag.defaults());
    }

    public List<PropertyInfo> getProperties(Set<BindingFlag> flags) {
        return filter(PropertyInfo.class, flags, null);
    }

    public PropertyInfo getProperty(String name) {
        List<PropertyInfo> properties = filter(PropertyInfo.class, BindingFlag.defaults(), name);
        return properties.isEmpty() ? null : properties.get(0);
    }

    public List<ConstructorInfo> getConstructors() {
        List<ConstructorInfo> result = new ArrayList<>();
        for (MemberInfo member : members()) {
            if (member instanceof ConstructorInfo) result.add((ConstructorInfo) member);
        }
        return result;
    }

    public MethodInfo getMethod(String name) {
        return getMethod(name, BindingFlag.defaults());
    }

    /**
     * 按名称查找单个方法，应用签名隐藏后仍有多个时抛出 {@link AmbiguousMatchException}。
     */
    public MethodInfo getMethod(String name, Set<BindingFlag> flags) {
        List<MethodInfo> methods = hide(filter(MethodInfo.class, flags, name));
        if (methods.size() > 1) {
            throw new AmbiguousMatchException("Multiple methods named '" + name + "' were found.");
        }
        return methods.isEmpty() ? null : methods.get(0);
    }

    /** 按参数类型精确匹配 */
    public MethodInfo getMethod(String name, List<TypeDescriptor> parameterTypes) {
        for (MethodInfo method : hide(filter(MethodInfo.class, BindingFlag.defaults(), name))) {
            List<ParameterInfo> parameters = method.getParameters();
            if (parameters.size() != parameterTypes.size()) continue;
            boolean matches = true;
            for (int i = 0; i < parameters.size() && matches; i++) {
                matches = system.resolveType(parameters.get(i).getParameterType(), method.getDeclaringType())
                        == parameterTypes.get(i);
            }
            if (matches) return method;
        }
        return null;
    }

    private List<MethodInfo> hide(List<MethodInfo> methods) {
        Map<ResolvedMethod, MethodInfo> byMethod = new IdentityHashMap<>();
        List<ResolvedMethod> resolved = new ArrayList<>(methods.size());
        for (MethodInfo method : methods) {
            byMethod.put(method.getResolvedMethod(), method);
            resolved.add(method.getResolvedMethod());
        }
        List<MethodInfo> result = new ArrayList<>();
        for (ResolvedMethod survivor : MemberHiding.hide(resolved, m -> m.getRecord().isPlaceholder())) {
            result.add(byMethod.get(survivor));
        }
        return result;
    }

    private <T extends MemberInfo> List<T> filter(Class<T> kind, Set<BindingFlag> flags, String name) {
        Set<BindingFlag> effective = flags == null || flags.isEmpty() ? BindingFlag.defaults() : EnumSet.copyOf(flags);
        boolean publicOnly = effective.contains(BindingFlag.PUBLIC) && !effective.contains(BindingFlag.NON_PUBLIC);
        boolean nonPublicOnly = effective.contains(BindingFlag.NON_PUBLIC) && !effective.contains(BindingFlag.PUBLIC);
        boolean staticOnly = effective.contains(BindingFlag.STATIC) && !effective.contains(BindingFlag.INSTANCE);
        boolean instanceOnly = effective.contains(BindingFlag.INSTANCE) && !effective.contains(BindingFlag.STATIC);
        boolean declaredOnly = effective.contains(BindingFlag.DECLARED_ONLY);

        List<T> result = new ArrayList<>();
        for (MemberInfo member : members()) {
            if (!kind.isInstance(member) || member instanceof ConstructorInfo) continue;
            boolean inherited = member.getDeclaringType() != type;
            if (inherited && (declaredOnly || member.isStatic())) continue;
            if (publicOnly && !member.isPublic()) continue;
            if (nonPublicOnly && member.isPublic()) continue;
            if (staticOnly && !member.isStatic()) continue;
            if (instanceOnly && member.isStatic()) continue;
            if (name != null && !name.equals(member.getName())) continue;
            result.add(kind.cast(member));
        }
        return result;
    }

    private List<MemberInfo> members() {
        List<MemberInfo> result = members;
        if (result == null) {
            List<MemberInfo> list = new ArrayList<>();
            for (TypeDescriptor t = type; t != null; t = t.getBaseType()) {
                for (MemberRecord record : t.getMembers()) {
                    MemberInfo info = toInfo(t, record);
                    if (info != null) list.add(info);
                }
            }
            result = Collections.unmodifiableList(list);
            members = result;
        }
        return result;
    }

    private MemberInfo toInfo(TypeDescriptor declaring, MemberRecord record) {
        if (record instanceof MethodRecord) {
            ResolvedMethod method = system.resolveMethod(declaring, (MethodRecord) record);
            if (record.getKind() == MemberKind.CONSTRUCTOR) {
                return declaring == type ? new ConstructorInfo(system, method) : null;
            }
            return new MethodInfo(system, method);
        }
        if (record instanceof FieldRecord) return new FieldInfo(system, declaring, (FieldRecord) record);
        if (record instanceof PropertyRecord) return new PropertyInfo(system, declaring, (PropertyRecord) record);
        return null;
    }

    @Override
    public String toString() {
        return "<TypeInfo " + type.getFullName() + ">";
    }
}
