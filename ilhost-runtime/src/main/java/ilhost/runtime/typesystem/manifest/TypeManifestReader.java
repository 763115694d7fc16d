package ilhost.runtime.typesystem.manifest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import ilhost.runtime.RegistrationException;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.PositionalGenericParameter;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;
import ilhost.runtime.typesystem.InterfaceBuilder;
import ilhost.runtime.typesystem.TypeDeclaration;
import ilhost.runtime.typesystem.TypeHandle;
import ilhost.runtime.typesystem.TypeSystem;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * 从 JSON 清单声明加载单元中的类型。
 *
 * <p>清单里的方法一律按外部方法声明，实现通过
 * {@link TypeSystem#implementExternals} 提供，缺失时调用会报告未实现。</p>
 *
 * <pre>
 * {
 *   "loadUnit": "Zoo, Version=1.0.0.0",
 *   "types": [
 *     { "name": "Zoo.Box", "genericParameters": ["T"],
 *       "fields": [ { "name": "Value", "type": "!T" } ],
 *       "methods": [ { "name": "Get", "returnType": "!T" } ] }
 *   ]
 * }
 * </pre>
 */
public final class TypeManifestReader {

    private static final Logger LOG = Logger.getLogger(TypeManifestReader.class.getName());

    private final TypeSystem system;
    private final Gson gson;

    public TypeManifestReader(TypeSystem system) {
        this.system = system;
        this.gson = new GsonBuilder().create();
    }

    /** 解析清单但不声明 */
    public LoadUnitManifest read(Reader reader) {
        LoadUnitManifest manifest;
        try {
            manifest = gson.fromJson(reader, LoadUnitManifest.class);
        } catch (JsonParseException e) {
            throw new RegistrationException("Malformed type manifest: " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new RegistrationException("Type manifest is empty");
        }
        if (manifest.getLoadUnit() == null || manifest.getLoadUnit().trim().isEmpty()) {
            throw new RegistrationException("Type manifest does not name a load unit");
        }
        return manifest;
    }

    public List<TypeHandle> load(String json) {
        return load(new StringReader(json));
    }

    /** 从类路径资源加载清单 */
    public List<TypeHandle> loadResource(String resourceName) {
        InputStream in = TypeManifestReader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new RegistrationException("Type manifest resource not found: " + resourceName);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new RegistrationException("Failed to read type manifest " + resourceName, e);
        }
    }

    /** 解析并声明清单中的全部类型，返回按清单顺序排列的句柄 */
    public List<TypeHandle> load(Reader reader) {
        LoadUnitManifest manifest = read(reader);
        LoadUnit unit = system.declareLoadUnit(manifest.getLoadUnit());
        List<TypeHandle> handles = new ArrayList<>();
        for (TypeManifest type : manifest.getTypes()) {
            handles.add(system.declare(unit, toDeclaration(unit, type)));
        }
        LOG.fine("Loaded " + handles.size() + " type(s) from manifest of " + unit.getName());
        return handles;
    }

    TypeDeclaration toDeclaration(final LoadUnit unit, final TypeManifest type) {
        if (type.getName() == null || type.getName().isEmpty()) {
            throw new RegistrationException("Manifest type entry in " + unit.getName() + " has no name");
        }
        final String owner = type.getName();
        TypeDeclaration.Builder builder = TypeDeclaration.builder(kindOf(type), owner)
                .isPublic(type.isPublic())
                .genericParameters(type.getGenericParameters())
                .flagsEnum(type.isFlags())
                .enumMembers(type.getEnumMembers());
        if (type.getBase() != null) {
            TypeReference base = parseReference(unit, owner, type.getBase());
            if (base instanceof TypeRef && ((TypeRef) base).getGenericArguments().isEmpty()) {
                builder.baseType(((TypeRef) base).getTypeName());
            } else {
                builder.baseType(base);
            }
        }
        for (String iface : type.getInterfaces()) {
            builder.interfaces(parseReference(unit, owner, iface));
        }
        builder.initializer($ -> declareMembers($, unit, owner, type));
        return builder.build();
    }

    private void declareMembers(InterfaceBuilder $, LoadUnit unit, String owner, TypeManifest type) {
        for (MemberManifest field : type.getFields()) {
            MemberFlags flags = MemberFlags.of(field.isStatic(), field.isPublic());
            TypeReference fieldType = parseReference(unit, owner, required(field.getType(), "type", field, owner));
            Object value = toValue(field.getValue(), fieldType);
            if (value == null) {
                $.field(flags, field.getName(), fieldType);
            } else {
                $.field(flags, field.getName(), fieldType, value);
            }
        }
        for (MemberManifest constant : type.getConstants()) {
            TypeReference constantType = parseReference(unit, owner,
                    required(constant.getType(), "type", constant, owner));
            $.constant(constant.isPublic(), constant.getName(), constantType,
                    toValue(constant.getValue(), constantType));
        }
        for (MemberManifest property : type.getProperties()) {
            $.property(MemberFlags.of(property.isStatic(), property.isPublic()), property.getName(),
                    parseReference(unit, owner, required(property.getType(), "type", property, owner)));
        }
        for (MemberManifest method : type.getMethods()) {
            $.externalMethod(MemberFlags.of(method.isStatic(), method.isPublic()), method.getName(),
                    signatureOf(unit, owner, method));
        }
        for (MemberManifest method : type.getInterfaceMethods()) {
            $.interfaceMethod(method.getName(), signatureOf(unit, owner, method));
        }
        for (String property : type.getInterfaceProperties()) {
            $.interfaceProperty(property);
        }
    }

    private MethodSignature signatureOf(LoadUnit unit, String owner, MemberManifest method) {
        if (method.getName() == null) {
            throw new RegistrationException("Manifest method on '" + owner + "' has no name");
        }
        TypeReference returnType = method.getReturnType() == null
                ? null : parseReference(unit, owner, method.getReturnType());
        List<TypeReference> arguments = new ArrayList<>();
        for (String parameter : method.getParameters()) {
            arguments.add(parseReference(unit, owner, parameter));
        }
        return new MethodSignature(returnType, arguments,
                method.getGenericParameters().isEmpty() ? null : method.getGenericParameters());
    }

    static TypeKind kindOf(TypeManifest type) {
        String kind = type.getKind() == null ? "class" : type.getKind();
        try {
            return TypeKind.valueOf(kind.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new RegistrationException("Unknown type kind '" + kind + "' for '" + type.getName() + "'", e);
        }
    }

    /**
     * 解析类型引用文本：{@code !!N} 方法泛型参数，{@code !T} 本类型泛型参数，
     * {@code Name<A, B>} 带参数的类型。
     */
    static TypeReference parseReference(LoadUnit unit, String owner, String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new RegistrationException("Empty type reference in manifest of '" + owner + "'");
        }
        if (trimmed.startsWith("!!")) {
            try {
                return new PositionalGenericParameter(Integer.parseInt(trimmed.substring(2)));
            } catch (NumberFormatException e) {
                throw new RegistrationException("Invalid positional generic parameter '" + trimmed + "'", e);
            }
        }
        if (trimmed.startsWith("!")) {
            return new GenericParameter(trimmed.substring(1), owner, unit);
        }
        int open = trimmed.indexOf('<');
        if (open < 0) {
            return new TypeRef(unit, trimmed, Collections.<TypeReference>emptyList());
        }
        if (!trimmed.endsWith(">")) {
            throw new RegistrationException("Unbalanced generic arguments in type reference '" + trimmed + "'");
        }
        List<TypeReference> arguments = new ArrayList<>();
        for (String argument : splitArguments(trimmed.substring(open + 1, trimmed.length() - 1))) {
            arguments.add(parseReference(unit, owner, argument));
        }
        return new TypeRef(unit, trimmed.substring(0, open).trim(), arguments);
    }

    private static List<String> splitArguments(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    /** JSON 值按声明类型转换为宿主值 */
    static Object toValue(JsonElement value, TypeReference declaredType) {
        if (value == null || value.isJsonNull()) return null;
        if (!value.isJsonPrimitive()) {
            throw new RegistrationException("Only primitive manifest values are supported, got " + value);
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) return primitive.getAsBoolean();
        if (primitive.isString()) {
            String typeName = declaredType instanceof TypeRef ? ((TypeRef) declaredType).getTypeName() : "";
            if ("System.Char".equals(typeName) && primitive.getAsString().length() == 1) {
                return primitive.getAsString().charAt(0);
            }
            return primitive.getAsString();
        }
        String typeName = declaredType instanceof TypeRef ? ((TypeRef) declaredType).getTypeName() : "";
        switch (typeName) {
            case "System.Byte":
            case "System.SByte":
                return primitive.getAsByte();
            case "System.Int16":
                return primitive.getAsShort();
            case "System.Int32":
            case "System.UInt16":
                return primitive.getAsInt();
            case "System.Int64":
            case "System.UInt32":
            case "System.UInt64":
                return primitive.getAsLong();
            case "System.Single":
                return primitive.getAsFloat();
            default:
                return primitive.getAsDouble();
        }
    }

    private static String required(String value, String attribute, MemberManifest member, String owner) {
        if (value == null) {
            throw new RegistrationException("Manifest member '" + member.getName() + "' on '" + owner
                    + "' is missing '" + attribute + "'");
        }
        return value;
    }
}
