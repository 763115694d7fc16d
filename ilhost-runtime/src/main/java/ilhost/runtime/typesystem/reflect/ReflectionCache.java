package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.typesystem.TypeSystem;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 每个类型描述符一个 {@link TypeInfo}。描述符按身份比较，闭包实例化各有各的视图。
 */
public final class ReflectionCache {

    private final TypeSystem system;
    private final ConcurrentMap<TypeDescriptor, TypeInfo> types = new ConcurrentHashMap<>();

    public ReflectionCache(TypeSystem system) {
        this.system = system;
    }

    public TypeInfo typeInfo(TypeDescriptor type) {
        return types.computeIfAbsent(type, t -> new TypeInfo(system, t));
    }
}
