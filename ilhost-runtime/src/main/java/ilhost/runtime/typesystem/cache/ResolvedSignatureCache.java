package ilhost.runtime.typesystem.cache;

import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.TypeDescriptor;

import java.util.function.BiFunction;

/**
 * 签名在某个闭包类型的泛型绑定下替换后的结果缓存。
 *
 * <p>键为（类型标识，签名对象身份）。签名没有变化时缓存原对象本身。</p>
 */
public final class ResolvedSignatureCache {

    private final BoundedCache<Key, MethodSignature> cache;

    public ResolvedSignatureCache(long maximumSize) {
        this.cache = new CaffeineCache<>(maximumSize);
    }

    public MethodSignature resolve(TypeDescriptor context, MethodSignature signature,
                                   BiFunction<TypeDescriptor, MethodSignature, MethodSignature> resolver) {
        return cache.computeIfAbsent(new Key(context.getTypeId(), signature),
                k -> resolver.apply(context, signature));
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public void clear() {
        cache.clear();
    }

    private static final class Key {
        private final String typeId;
        private final MethodSignature signature;

        Key(String typeId, MethodSignature signature) {
            this.typeId = typeId;
            this.signature = signature;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return signature == other.signature && typeId.equals(other.typeId);
        }

        @Override
        public int hashCode() {
            return 31 * typeId.hashCode() + System.identityHashCode(signature);
        }
    }
}
