package ilhost.runtime.typesystem;

import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeReference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 类型声明请求：名称、可见性、基类、泛型参数、接口、成员初始化器。
 *
 * <pre>
 * TypeDeclaration decl = TypeDeclaration.builder(TypeKind.CLASS, "Zoo.Dog")
 *     .baseType("Zoo.Animal")
 *     .initializer($ -&gt; $.method(MemberFlags.PUBLIC_INSTANCE, "Bark", $.signature(null), body))
 *     .build();
 * </pre>
 */
public final class TypeDeclaration {

    private final TypeKind kind;
    private final String fullName;
    private final boolean isPublic;
    private final Object baseType;
    private final List<String> genericParameters;
    private final List<Object> interfaces;
    private final Consumer<InterfaceBuilder> initializer;
    private final Map<String, Long> enumMembers;
    private final boolean flagsEnum;

    private TypeDeclaration(Builder builder) {
        this.fullName = builder.fullName;
        this.isPublic = builder.isPublic;
        this.baseType = builder.baseType;
        this.genericParameters = Collections.unmodifiableList(new ArrayList<>(builder.genericParameters));
        this.interfaces = Collections.unmodifiableList(new ArrayList<>(builder.interfaces));
        this.initializer = builder.initializer;
        this.enumMembers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.enumMembers));
        this.flagsEnum = builder.flagsEnum;
        if (builder.kind == TypeKind.CLASS && baseType instanceof String
                && ((String) baseType).endsWith("System.ValueType")) {
            this.kind = TypeKind.STRUCT;
        } else {
            this.kind = builder.kind;
        }
    }

    public static Builder builder(TypeKind kind, String fullName) {
        return new Builder(kind, fullName);
    }

    public TypeKind getKind() { return kind; }
    public String getFullName() { return fullName; }
    public boolean isPublic() { return isPublic; }

    /** 基类：类型名（String）、{@link TypeReference} 或 null */
    public Object getBaseType() { return baseType; }

    public List<String> getGenericParameters() { return genericParameters; }
    public List<Object> getInterfaces() { return interfaces; }
    public Consumer<InterfaceBuilder> getInitializer() { return initializer; }
    public Map<String, Long> getEnumMembers() { return enumMembers; }
    public boolean isFlagsEnum() { return flagsEnum; }

    // ============ Builder ============

    public static final class Builder {
        private final TypeKind kind;
        private final String fullName;
        private boolean isPublic = true;
        private Object baseType;
        private final List<String> genericParameters = new ArrayList<>();
        private final List<Object> interfaces = new ArrayList<>();
        private Consumer<InterfaceBuilder> initializer;
        private final Map<String, Long> enumMembers = new LinkedHashMap<>();
        private boolean flagsEnum;

        private Builder(TypeKind kind, String fullName) {
            if (kind == null) {
                throw new RegistrationException("Type kind must be specified for '" + fullName + "'");
            }
            this.kind = kind;
            this.fullName = fullName;
        }

        public Builder isPublic(boolean isPublic) {
            this.isPublic = isPublic;
            return this;
        }

        public Builder baseType(String baseTypeName) {
            this.baseType = baseTypeName;
            return this;
        }

        public Builder baseType(TypeReference baseTypeReference) {
            this.baseType = baseTypeReference;
            return this;
        }

        public Builder genericParameters(String... names) {
            this.genericParameters.addAll(Arrays.asList(names));
            return this;
        }

        public Builder genericParameters(List<String> names) {
            this.genericParameters.addAll(names);
            return this;
        }

        /** 接口：类型名或 {@link TypeReference} */
        public Builder interfaces(Object... interfaceReferences) {
            this.interfaces.addAll(Arrays.asList(interfaceReferences));
            return this;
        }

        public Builder initializer(Consumer<InterfaceBuilder> initializer) {
            this.initializer = initializer;
            return this;
        }

        public Builder enumMember(String name, long value) {
            this.enumMembers.put(name, value);
            return this;
        }

        public Builder enumMembers(Map<String, Long> members) {
            this.enumMembers.putAll(members);
            return this;
        }

        public Builder flagsEnum(boolean flags) {
            this.flagsEnum = flags;
            return this;
        }

        public TypeDeclaration build() {
            if (kind != TypeKind.ENUM && !enumMembers.isEmpty()) {
                throw new RegistrationException("Only enumerations can declare enum members: " + fullName);
            }
            if (kind == TypeKind.ARRAY || kind == TypeKind.ANY) {
                throw new RegistrationException("Type kind " + kind + " cannot be declared: " + fullName);
            }
            return new TypeDeclaration(this);
        }
    }
}
