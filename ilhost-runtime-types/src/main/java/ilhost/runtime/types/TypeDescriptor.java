package ilhost.runtime.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 类型描述符：每个声明的类型一个，每个闭包泛型实例化再各一个。
 *
 * <p>描述符按引用比较身份；{@link #getTypeId()} 在进程内稳定，
 * 闭包实例化的标识是开放类型标识加上实参标识列表。</p>
 */
public final class TypeDescriptor implements TypeReference {

    private final TypeKind kind;
    private final LoadUnit context;
    private final String fullName;
    private final String shortName;
    private final String typeId;
    private final boolean referenceType;
    private final List<GenericParameter> genericParameters;

    // 继承
    private TypeReference baseReference;
    private volatile TypeDescriptor baseType;
    private int inheritanceDepth;
    private final List<TypeReference> interfaces = new CopyOnWriteArrayList<>();

    // 泛型
    private List<TypeReference> genericArguments = Collections.emptyList();
    private TypeDescriptor openType;
    private boolean closed;
    private final Map<String, TypeReference> genericBindings = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TypeDescriptor> closedTypes = new ConcurrentHashMap<>();

    // 成员
    private final List<MemberRecord> members = new CopyOnWriteArrayList<>();
    private final Map<String, String> renamedMethods = new ConcurrentHashMap<>();
    private final Map<String, InterfaceMember> interfaceMembers = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Consumer<PublicInterface>> initializers = new CopyOnWriteArrayList<>();
    private final List<String> rawStaticMethods = new CopyOnWriteArrayList<>();
    private PublicInterface publicInterface;

    // 初始化状态
    private volatile boolean initialized;
    private volatile RuntimeException initializationFailure;
    private volatile Set<String> assignableTypes;

    // 种类专属
    private Predicate<Object> customTypeCheck;
    private TypeDescriptor metaType;
    private TypeDescriptor elementType;
    private boolean flagsEnum;
    private final Map<String, EnumValue> enumValues = Collections.synchronizedMap(new LinkedHashMap<>());

    public TypeDescriptor(TypeKind kind, LoadUnit context, String fullName, String typeId,
                          List<String> genericParameterNames) {
        this.kind = kind;
        this.context = context;
        this.fullName = fullName;
        this.shortName = Names.localName(fullName);
        this.typeId = typeId;
        this.referenceType = kind != TypeKind.STRUCT && kind != TypeKind.ENUM;
        List<GenericParameter> params = new ArrayList<>(genericParameterNames.size());
        for (String name : genericParameterNames) {
            params.add(new GenericParameter(name, fullName, context));
        }
        this.genericParameters = Collections.unmodifiableList(params);
        this.closed = params.isEmpty();
    }

    /** 闭包实例化：沿用开放类型的泛型参数对象 */
    public TypeDescriptor(TypeDescriptor openType, String fullName, String typeId) {
        this.kind = openType.kind;
        this.context = openType.context;
        this.fullName = fullName;
        this.shortName = Names.localName(fullName);
        this.typeId = typeId;
        this.referenceType = openType.referenceType;
        this.genericParameters = openType.genericParameters;
        this.openType = openType;
        this.inheritanceDepth = openType.inheritanceDepth;
        this.baseReference = openType.baseReference;
        this.members.addAll(openType.members);
        this.renamedMethods.putAll(openType.renamedMethods);
        this.interfaceMembers.putAll(openType.interfaceMembers);
        this.rawStaticMethods.addAll(openType.rawStaticMethods);
        this.customTypeCheck = openType.customTypeCheck;
        this.metaType = openType.metaType;
        this.elementType = openType.elementType;
        this.flagsEnum = openType.flagsEnum;
    }

    // ============ 基本信息 ============

    public TypeKind getKind() { return kind; }
    public LoadUnit getContext() { return context; }
    public String getFullName() { return fullName; }
    public String getShortName() { return shortName; }
    public String getTypeId() { return typeId; }
    public boolean isReferenceType() { return referenceType; }
    public boolean isValueType() { return !referenceType; }
    public boolean isInterface() { return kind == TypeKind.INTERFACE; }
    public boolean isEnum() { return kind == TypeKind.ENUM; }
    public boolean isArray() { return kind == TypeKind.ARRAY; }
    public boolean isDelegate() { return kind == TypeKind.DELEGATE; }

    public TypeRuntime getRuntime() {
        return context.getRuntime();
    }

    @Override
    public String typeId() {
        return typeId;
    }

    @Override
    public String displayName() {
        return fullName;
    }

    // ============ 继承 ============

    public TypeReference getBaseReference() { return baseReference; }
    public void setBaseReference(TypeReference baseReference) { this.baseReference = baseReference; }

    public TypeDescriptor getBaseType() { return baseType; }
    public void setBaseType(TypeDescriptor baseType) { this.baseType = baseType; }

    public int getInheritanceDepth() { return inheritanceDepth; }
    public void setInheritanceDepth(int inheritanceDepth) { this.inheritanceDepth = inheritanceDepth; }

    /** 声明的接口引用（包括从基类继承的），解析在初始化时进行 */
    public List<TypeReference> getInterfaces() { return interfaces; }

    public void addInterface(TypeReference iface) {
        if (!interfaces.contains(iface)) interfaces.add(iface);
    }

    // ============ 泛型 ============

    public List<GenericParameter> getGenericParameters() { return genericParameters; }

    public boolean isGenericDefinition() {
        return openType == null && !genericParameters.isEmpty();
    }

    public List<TypeReference> getGenericArguments() { return genericArguments; }

    public void setGenericArguments(List<? extends TypeReference> arguments) {
        this.genericArguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /** 闭包实例化的开放类型，非实例化时为 null */
    public TypeDescriptor getOpenType() { return openType; }

    public boolean isClosed() { return closed; }
    public void setClosed(boolean closed) { this.closed = closed; }

    /** 泛型参数键 → 实参（沿基类链收集） */
    public Map<String, TypeReference> getGenericBindings() { return genericBindings; }

    /** 实参标识键 → 闭包实例化 */
    public ConcurrentMap<String, TypeDescriptor> getClosedTypes() { return closedTypes; }

    // ============ 成员 ============

    public List<MemberRecord> getMembers() { return members; }

    public void addMember(MemberRecord record) {
        members.add(record);
    }

    /** 闭包后因签名变化而改名的方法：旧修饰名 → 新修饰名 */
    public Map<String, String> getRenamedMethods() { return renamedMethods; }

    /** 接口类型声明的成员 */
    public Map<String, InterfaceMember> getInterfaceMembers() { return interfaceMembers; }

    /** 初始化时依次执行的附加初始化器 */
    public List<Consumer<PublicInterface>> getInitializers() { return initializers; }

    /** 不进入方法组的静态原始方法（转义名），闭包时重新绑定到新的公共接口 */
    public List<String> getRawStaticMethods() { return rawStaticMethods; }

    public PublicInterface getPublicInterface() { return publicInterface; }

    public void setPublicInterface(PublicInterface publicInterface) {
        if (this.publicInterface != null) {
            throw new IllegalStateException("Public interface of " + fullName + " already assigned");
        }
        this.publicInterface = publicInterface;
    }

    // ============ 初始化状态 ============

    public boolean isInitialized() { return initialized; }
    public void markInitialized() { this.initialized = true; }

    /** 初始化失败的原因，未失败时为 null */
    public RuntimeException getInitializationFailure() { return initializationFailure; }
    public void markInitializationFailed(RuntimeException cause) { this.initializationFailure = cause; }

    /** 可赋值集合，尚未计算时为 null */
    public Set<String> getAssignableTypes() { return assignableTypes; }
    public void setAssignableTypes(Set<String> assignableTypes) { this.assignableTypes = assignableTypes; }

    // ============ 种类专属 ============

    public Predicate<Object> getCustomTypeCheck() { return customTypeCheck; }
    public void setCustomTypeCheck(Predicate<Object> customTypeCheck) { this.customTypeCheck = customTypeCheck; }

    /** 类型对象自身的类型（通常为 System.RuntimeType） */
    public TypeDescriptor getMetaType() { return metaType; }
    public void setMetaType(TypeDescriptor metaType) { this.metaType = metaType; }

    /** 数组元素类型 */
    public TypeDescriptor getElementType() { return elementType; }
    public void setElementType(TypeDescriptor elementType) { this.elementType = elementType; }

    public boolean isFlagsEnum() { return flagsEnum; }
    public void setFlagsEnum(boolean flagsEnum) { this.flagsEnum = flagsEnum; }

    public void addEnumValue(EnumValue value) {
        enumValues.put(value.getName(), value);
    }

    public EnumValue getEnumValue(String name) {
        return enumValues.get(name);
    }

    /** 按数值查找具名枚举值，没有时返回 null */
    public EnumValue findEnumValue(long value) {
        synchronized (enumValues) {
            for (EnumValue v : enumValues.values()) {
                if (v.getValue() == value) return v;
            }
        }
        return null;
    }

    public List<EnumValue> getEnumValues() {
        synchronized (enumValues) {
            return new ArrayList<>(enumValues.values());
        }
    }

    @Override
    public String toString() {
        return fullName;
    }
}
