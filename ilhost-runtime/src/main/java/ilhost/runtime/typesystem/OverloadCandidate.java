package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.PositionalGenericParameter;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;

import java.util.ArrayList;
import java.util.List;

/**
 * 方法组中的一个重载：替换后的签名、实现，以及首次分派时才解析的形参类型。
 */
final class OverloadCandidate {

    private final TypeSystem system;
    private final ResolvedMethod method;
    private final Invokable implementation;
    private volatile TypeDescriptor[] expected;
    private volatile boolean[] callSite;

    OverloadCandidate(TypeSystem system, ResolvedMethod method, Invokable implementation) {
        this.system = system;
        this.method = method;
        this.implementation = implementation;
    }

    ResolvedMethod getMethod() {
        return method;
    }

    Invokable getImplementation() {
        return implementation;
    }

    int getArgumentCount() {
        return method.getSignature().getArgumentCount();
    }

    String describe() {
        return method.describe();
    }

    /**
     * 形参类型，null 为通配（未绑定的泛型参数，或依赖调用方泛型实参的形参）
     */
    TypeDescriptor[] expectedTypes() {
        TypeDescriptor[] result = expected;
        if (result == null) {
            List<TypeReference> arguments = method.getSignature().getArgumentTypes();
            TypeDescriptor[] types = new TypeDescriptor[arguments.size()];
            boolean[] dependent = new boolean[arguments.size()];
            for (int i = 0; i < types.length; i++) {
                TypeReference reference = arguments.get(i);
                if (dependsOnCallSite(reference)) {
                    dependent[i] = true;
                } else if (!(reference instanceof GenericParameter)) {
                    types[i] = system.closure().resolveDescriptor(reference, method.getContext());
                }
            }
            callSite = dependent;
            expected = types;
            result = types;
        }
        return result;
    }

    /**
     * @param offset 实参数组中调用参数的起点，前面是方法泛型实参
     */
    boolean matches(Object[] args, int offset) {
        TypeDescriptor[] types = expectedTypes();
        boolean[] dependent = callSite;
        for (int i = 0; i < types.length; i++) {
            TypeDescriptor type = dependent[i]
                    ? resolveAtCallSite(method.getSignature().getArgumentTypes().get(i), args, offset)
                    : types[i];
            if (!accepts(type, args[offset + i])) return false;
        }
        return true;
    }

    private boolean accepts(TypeDescriptor type, Object value) {
        if (type == null || type.getKind() == TypeKind.ANY) return true;
        if (value == null) return type.isReferenceType();
        return system.checkType(value, type);
    }

    private TypeDescriptor resolveAtCallSite(TypeReference reference, Object[] args, int offset) {
        TypeReference substituted = substitutePositional(reference, args, offset);
        if (substituted == null || dependsOnCallSite(substituted)) return null;
        return system.closure().resolveDescriptor(substituted, method.getContext());
    }

    private TypeReference substitutePositional(TypeReference reference, Object[] args, int offset) {
        if (reference instanceof PositionalGenericParameter) {
            int index = ((PositionalGenericParameter) reference).getIndex();
            if (index >= offset) return null;
            return system.toType(args[index]);
        }
        if (reference instanceof TypeRef) {
            TypeRef ref = (TypeRef) reference;
            List<TypeReference> arguments = new ArrayList<>(ref.getGenericArguments().size());
            for (TypeReference argument : ref.getGenericArguments()) {
                TypeReference substituted = substitutePositional(argument, args, offset);
                if (substituted == null) return null;
                arguments.add(substituted);
            }
            return ref.withGenericArguments(arguments);
        }
        return reference;
    }

    private static boolean dependsOnCallSite(TypeReference reference) {
        if (reference instanceof PositionalGenericParameter) return true;
        if (reference instanceof TypeRef) {
            for (TypeReference argument : ((TypeRef) reference).getGenericArguments()) {
                if (dependsOnCallSite(argument)) return true;
            }
        }
        return false;
    }

    /**
     * 每个形参都可赋值给 other 的对应形参且至少一个不同时更具体。通配形参只与通配相等。
     */
    boolean isMoreSpecificThan(OverloadCandidate other) {
        TypeDescriptor[] mine = expectedTypes();
        TypeDescriptor[] theirs = other.expectedTypes();
        if (mine.length != theirs.length) return false;
        boolean strictly = false;
        for (int i = 0; i < mine.length; i++) {
            if (mine[i] == theirs[i]) continue;
            if (mine[i] == null || theirs[i] == null) return false;
            if (!system.isAssignable(mine[i], theirs[i])) return false;
            strictly = true;
        }
        return strictly;
    }

    @Override
    public String toString() {
        return describe();
    }
}
