package ilhost.runtime.typesystem;

import ilhost.runtime.InvalidGenericArgumentException;
import ilhost.runtime.Invokable;
import ilhost.runtime.types.GenericParameter;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeIds;
import ilhost.runtime.types.TypeRef;
import ilhost.runtime.types.TypeReference;
import ilhost.runtime.typesystem.cache.ResolvedSignatureCache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 泛型闭包：每个开放类型按实参标识键缓存唯一的闭包实例化。
 *
 * <p>新实例化在填充完成前就放入缓存，所以自引用的泛型（如 {@code Node<T> : IComparable<Node<T>>}）
 * 在闭包过程中再次请求同一实参时得到同一个描述符。</p>
 */
final class GenericClosure {

    private static final Logger LOG = Logger.getLogger(GenericClosure.class.getName());

    /** 绑定链追踪的上限，防止自绑定的参数死循环 */
    private static final int MAX_BINDING_HOPS = 64;

    private final TypeSystem system;
    private final ResolvedSignatureCache signatureCache;

    GenericClosure(TypeSystem system, ResolvedSignatureCache signatureCache) {
        this.system = system;
        this.signatureCache = signatureCache;
    }

    // ============ 闭包 ============

    TypeDescriptor close(TypeDescriptor openType, List<?> arguments, boolean initialize) {
        if (openType.getOpenType() != null) {
            throw new InvalidGenericArgumentException("Type '" + openType.getFullName()
                    + "' is already an instantiation and cannot be closed again");
        }
        int expected = openType.getGenericParameters().size();
        if (arguments == null || arguments.size() != expected) {
            throw new InvalidGenericArgumentException("Invalid number of generic arguments for type '"
                    + openType.getFullName() + "' (got " + (arguments == null ? 0 : arguments.size())
                    + ", expected " + expected + ")");
        }
        List<TypeReference> resolvedArguments = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            resolvedArguments.add(normalizeArgument(openType, i, arguments.get(i)));
        }
        String key = TypeIds.hashArguments(resolvedArguments);

        TypeDescriptor result = openType.getClosedTypes().get(key);
        if (result == null) {
            system.lock().lock();
            try {
                result = openType.getClosedTypes().get(key);
                if (result == null) {
                    result = instantiate(openType, resolvedArguments, key);
                }
            } finally {
                system.lock().unlock();
            }
        }
        if (initialize && openType.isInitialized() && !result.isInitialized()) {
            system.initialize(result);
        }
        return result;
    }

    private TypeReference normalizeArgument(TypeDescriptor openType, int index, Object argument) {
        if (argument == null) {
            throw new InvalidGenericArgumentException("Undefined or null passed as generic argument #" + index
                    + " of type '" + openType.getFullName() + "'");
        }
        if (argument instanceof TypeDescriptor || argument instanceof GenericParameter) {
            return (TypeReference) argument;
        }
        if (argument instanceof PublicInterface) {
            return ((PublicInterface) argument).getType();
        }
        if (argument instanceof TypeHandle) {
            return ((TypeHandle) argument).get(false).getType();
        }
        if (argument instanceof TypeRef) {
            return ((TypeRef) argument).resolve(false);
        }
        if (argument instanceof String) {
            return system.resolveTypeName(openType.getContext(), (String) argument, false);
        }
        if (argument instanceof TypeReference) {
            return (TypeReference) argument;
        }
        throw new InvalidGenericArgumentException("Generic argument #" + index + " of type '"
                + openType.getFullName() + "' is not a type: " + argument);
    }

    private TypeDescriptor instantiate(TypeDescriptor openType, List<TypeReference> arguments, String key) {
        StringBuilder name = new StringBuilder(openType.getFullName()).append('[');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) name.append(", ");
            name.append(arguments.get(i).displayName());
        }
        name.append(']');

        TypeDescriptor closed = new TypeDescriptor(openType, name.toString(), openType.getTypeId() + "[" + key + "]");
        closed.setGenericArguments(arguments);
        openType.getClosedTypes().put(key, closed);

        boolean isClosed = true;
        for (int i = 0; i < arguments.size(); i++) {
            TypeReference argument = arguments.get(i);
            closed.getGenericBindings().put(openType.getGenericParameters().get(i).getKey(), argument);
            if (!isClosedArgument(argument)) isClosed = false;
        }
        for (Map.Entry<String, TypeReference> inherited : openType.getGenericBindings().entrySet()) {
            closed.getGenericBindings().putIfAbsent(inherited.getKey(), resolveReference(inherited.getValue(), closed));
        }
        closed.setClosed(isClosed);

        TypeDescriptor base = null;
        if (openType.getBaseType() != null) {
            base = resolveDescriptor(closed.getBaseReference() != null ? closed.getBaseReference() : openType.getBaseType(),
                    closed);
            closed.setBaseType(base);
            closed.setBaseReference(base);
            closed.setInheritanceDepth(base.getInheritanceDepth() + 1);
            for (Map.Entry<String, TypeReference> binding : base.getGenericBindings().entrySet()) {
                closed.getGenericBindings().putIfAbsent(binding.getKey(), binding.getValue());
            }
        }

        PublicInterface openInterface = openType.getPublicInterface();
        PublicInterface pi = new PublicInterface(closed, openInterface.getStatics(), openInterface.getTemplate());
        closed.setPublicInterface(pi);

        for (TypeReference iface : openType.getInterfaces()) {
            closed.addInterface(resolveReference(iface, closed));
        }
        if (closed.isDelegate()) {
            closed.setCustomTypeCheck(TypeFactory.delegateCheck(closed));
        }
        if (isClosed) {
            renameGenericMethods(closed);
        }
        rebindRawMethods(closed);
        LOG.fine("Closed " + openType.getFullName() + " as " + closed.getFullName() + " (id " + closed.getTypeId() + ")");
        return closed;
    }

    private static boolean isClosedArgument(TypeReference argument) {
        if (argument instanceof GenericParameter) return false;
        if (argument instanceof TypeDescriptor) {
            TypeDescriptor type = (TypeDescriptor) argument;
            return !type.isGenericDefinition() && type.isClosed();
        }
        return true;
    }

    /** 签名随绑定变化的方法换到新修饰名下，旧名在闭包类型上被遮蔽 */
    private void renameGenericMethods(TypeDescriptor closed) {
        PublicInterface pi = closed.getPublicInterface();
        for (MemberRecord record : closed.getMembers()) {
            if (!(record instanceof MethodRecord)) continue;
            MethodRecord method = (MethodRecord) record;
            MethodSignature resolved = resolveSignature(closed, method.getSignature());
            if (resolved == method.getSignature()) continue;
            String oldKey = method.getMangledName();
            String newKey = resolved.key(method.getDescriptor().getEscapedName());
            if (oldKey.equals(newKey)) continue;
            MemberTable table = method.isStatic() ? pi.getStatics() : pi.getTemplate();
            Object implementation = table.lookup(oldKey);
            table.define(oldKey, null);
            table.define(newKey, implementation);
            closed.getRenamedMethods().put(oldKey, newKey);
        }
    }

    /** 静态原始方法绑定到闭包类型的公共接口 */
    private static void rebindRawMethods(TypeDescriptor closed) {
        PublicInterface pi = closed.getPublicInterface();
        for (String key : closed.getRawStaticMethods()) {
            Object raw = pi.getStatics().lookup(key);
            if (raw instanceof Invokable) {
                pi.getStatics().define(key, Invokables.bindSelf((Invokable) raw, pi));
            }
        }
    }

    // ============ 引用解析 ============

    /**
     * 在 context 的泛型绑定下替换引用：泛型参数换成绑定的实参，
     * 带泛型实参的前向引用与开放实例化逐个替换实参。未绑定的参数原样返回。
     */
    TypeReference resolveReference(TypeReference reference, TypeDescriptor context) {
        if (reference == null || context == null) return reference;
        if (reference instanceof GenericParameter) {
            TypeReference current = reference;
            for (int hops = 0; hops < MAX_BINDING_HOPS && current instanceof GenericParameter; hops++) {
                TypeReference bound = context.getGenericBindings().get(((GenericParameter) current).getKey());
                if (bound == null || bound == current) break;
                current = bound;
            }
            return current;
        }
        if (reference instanceof TypeRef) {
            TypeRef ref = (TypeRef) reference;
            if (ref.getGenericArguments().isEmpty()) return ref;
            List<TypeReference> arguments = new ArrayList<>(ref.getGenericArguments().size());
            boolean changed = false;
            for (TypeReference argument : ref.getGenericArguments()) {
                TypeReference resolved = resolveReference(argument, context);
                changed |= resolved != argument;
                arguments.add(resolved);
            }
            return changed ? ref.withGenericArguments(arguments) : ref;
        }
        if (reference instanceof TypeDescriptor) {
            TypeDescriptor type = (TypeDescriptor) reference;
            if (type.getOpenType() == null || type.isClosed()) return type;
            List<TypeReference> arguments = new ArrayList<>(type.getGenericArguments().size());
            boolean changed = false;
            for (TypeReference argument : type.getGenericArguments()) {
                TypeReference resolved = resolveReference(argument, context);
                changed |= resolved != argument;
                arguments.add(resolved);
            }
            return changed ? close(type.getOpenType(), arguments, false) : type;
        }
        return reference;
    }

    /** 替换后解析为描述符（只构造不初始化） */
    TypeDescriptor resolveDescriptor(TypeReference reference, TypeDescriptor context) {
        TypeReference resolved = resolveReference(reference, context);
        if (resolved instanceof TypeDescriptor) return (TypeDescriptor) resolved;
        if (resolved instanceof TypeRef) return ((TypeRef) resolved).resolve(false);
        return null;
    }

    /** 签名在 context 的泛型绑定下替换后的结果，没有变化时返回原签名 */
    MethodSignature resolveSignature(TypeDescriptor context, MethodSignature signature) {
        if (context.getGenericBindings().isEmpty()) return signature;
        return signatureCache.resolve(context, signature, this::substitute);
    }

    private MethodSignature substitute(TypeDescriptor context, MethodSignature signature) {
        TypeReference returnType = resolveReference(signature.getReturnType(), context);
        boolean changed = returnType != signature.getReturnType();
        List<TypeReference> arguments = new ArrayList<>(signature.getArgumentCount());
        for (TypeReference argument : signature.getArgumentTypes()) {
            TypeReference resolved = resolveReference(argument, context);
            changed |= resolved != argument;
            arguments.add(resolved);
        }
        return changed ? signature.withTypes(returnType, arguments) : signature;
    }

    ResolvedSignatureCache getSignatureCache() {
        return signatureCache;
    }
}
