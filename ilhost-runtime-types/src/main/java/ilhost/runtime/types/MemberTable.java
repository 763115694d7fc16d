package ilhost.runtime.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 成员表：静态成员或实例模板的槽位，未命中时沿父表查找。
 *
 * <p>显式写入 null 会遮蔽父表中的同名槽（闭包类型重命名方法时使用）。</p>
 */
public final class MemberTable {

    private static final Object SHADOWED = new Object();

    private final String label;
    private final TypeDescriptor owner;
    private volatile MemberTable parent;
    private final Map<String, Object> slots = new ConcurrentHashMap<>();

    public MemberTable(String label, TypeDescriptor owner, MemberTable parent) {
        this.label = label;
        this.owner = owner;
        this.parent = parent;
    }

    public String getLabel() {
        return label;
    }

    /** 持有此表的类型，匿名模板为 null */
    public TypeDescriptor getOwner() {
        return owner;
    }

    public MemberTable getParent() {
        return parent;
    }

    public void setParent(MemberTable parent) {
        for (MemberTable t = parent; t != null; t = t.parent) {
            if (t == this) {
                throw new IllegalArgumentException("Member table cycle through " + label);
            }
        }
        this.parent = parent;
    }

    // ============ 查找 ============

    /** 沿父表链查找，未找到或被遮蔽时返回 null */
    public Object lookup(String key) {
        for (MemberTable t = this; t != null; t = t.parent) {
            Object value = t.slots.get(key);
            if (value == null) continue;
            if (value == SHADOWED) return null;
            if (value instanceof LazySlot) return t.materialize(key, (LazySlot) value);
            return value;
        }
        return null;
    }

    /** 是否能查找到非 null 的值 */
    public boolean has(String key) {
        return lookup(key) != null;
    }

    public boolean hasOwn(String key) {
        return slots.containsKey(key);
    }

    public Object getOwn(String key) {
        Object value = slots.get(key);
        if (value == null || value == SHADOWED) return null;
        if (value instanceof LazySlot) return materialize(key, (LazySlot) value);
        return value;
    }

    /** 持有该键的最近一层表 */
    public MemberTable findDeclaring(String key) {
        for (MemberTable t = this; t != null; t = t.parent) {
            if (t.slots.containsKey(key)) return t;
        }
        return null;
    }

    /** 本表是否（间接）以 other 为父表，自身也算 */
    public boolean isDerivedFrom(MemberTable other) {
        for (MemberTable t = this; t != null; t = t.parent) {
            if (t == other) return true;
        }
        return false;
    }

    public List<String> ownKeys() {
        List<String> keys = new ArrayList<>(slots.keySet());
        Collections.sort(keys);
        return keys;
    }

    // ============ 写入 ============

    public void define(String key, Object value) {
        slots.put(key, value == null ? SHADOWED : value);
    }

    /** 首次查找时才求值的槽，求值后经宿主的延迟队列降级为普通值 */
    public void defineLazy(String key, LazySlot slot) {
        slots.put(key, slot);
    }

    public void remove(String key) {
        slots.remove(key);
    }

    private Object materialize(String key, LazySlot slot) {
        Object value = slot.get();
        if (slot.getHost() != null) {
            slot.getHost().runLater(() -> slots.replace(key, slot, value == null ? SHADOWED : value));
        }
        return value;
    }

    @Override
    public String toString() {
        return "<MemberTable " + label + ">";
    }
}
