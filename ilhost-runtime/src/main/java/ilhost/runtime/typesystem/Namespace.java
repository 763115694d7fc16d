package ilhost.runtime.typesystem;

import ilhost.runtime.NameResolutionException;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 命名空间树节点，段名均为转义后的形式。
 */
final class Namespace {

    private final String name;
    private final ConcurrentMap<String, Namespace> children = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, TypeHandle> types = new ConcurrentHashMap<>();

    Namespace(String name) {
        this.name = name;
    }

    String getName() {
        return name;
    }

    /** 沿路径创建缺失的子命名空间 */
    Namespace declare(List<String> path) {
        Namespace current = this;
        for (String segment : path) {
            final Namespace parent = current;
            current = parent.children.computeIfAbsent(segment,
                    s -> new Namespace(parent.name.isEmpty() ? s : parent.name + "." + s));
        }
        return current;
    }

    void define(List<String> segments, TypeHandle handle) {
        Namespace ns = declare(segments.subList(0, segments.size() - 1));
        ns.types.put(segments.get(segments.size() - 1), handle);
    }

    TypeHandle resolve(List<String> segments) {
        Namespace current = this;
        for (int i = 0; i < segments.size() - 1; i++) {
            Namespace next = current.children.get(segments.get(i));
            if (next == null) {
                throw notFound(segments.get(i), current);
            }
            current = next;
        }
        String last = segments.get(segments.size() - 1);
        TypeHandle handle = current.types.get(last);
        if (handle == null) {
            throw notFound(last, current);
        }
        return handle;
    }

    /** 不抛异常的查找 */
    TypeHandle find(List<String> segments) {
        Namespace current = this;
        for (int i = 0; i < segments.size() - 1 && current != null; i++) {
            current = current.children.get(segments.get(i));
        }
        return current == null ? null : current.types.get(segments.get(segments.size() - 1));
    }

    private static NameResolutionException notFound(String segment, Namespace ns) {
        return new NameResolutionException("Could not find the name '" + segment + "' in the namespace '"
                + (ns.name.isEmpty() ? "<global>" : ns.name) + "'.");
    }
}
