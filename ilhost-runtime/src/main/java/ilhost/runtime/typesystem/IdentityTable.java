package ilhost.runtime.typesystem;

import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.Names;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 类型标识表：按（加载单元，转义名）驻留，首次请求时分配递增计数。
 *
 * <p>键只由给定的加载单元与名称决定；跨单元引用公开类型时由调用方先换成声明单元。</p>
 */
final class IdentityTable {

    private final AtomicInteger nextTypeId = new AtomicInteger();
    private final AtomicInteger nextLoadUnitId = new AtomicInteger();
    private final ConcurrentMap<String, String> typeIds = new ConcurrentHashMap<>();

    String nextLoadUnitPrefix() {
        return Integer.toString(nextLoadUnitId.incrementAndGet());
    }

    String assignTypeId(LoadUnit unit, String typeName) {
        String key = unit.getIdPrefix() + "$" + Names.escape(typeName);
        return typeIds.computeIfAbsent(key, k -> Integer.toString(nextTypeId.incrementAndGet()));
    }

    String genericParameterId(String qualifiedKey) {
        return typeIds.computeIfAbsent("!" + qualifiedKey, k -> Integer.toString(nextTypeId.incrementAndGet()));
    }
}
