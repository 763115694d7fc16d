package ilhost.runtime.typesystem.cache;

import java.util.function.Function;

/**
 * 有界缓存接口
 *
 * <p>只用于可重新计算的派生数据：条目被淘汰后重新计算得到等价结果。
 * 需要保持引用身份的映射（闭包类型缓存、标识表）不能放在这里。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在则返回 null
     */
    V get(K key);

    /**
     * 如果不存在则计算并缓存
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    long size();

    void clear();

    CacheStats getStats();
}
