package ilhost.runtime;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 类型系统运行选项
 *
 * <p>使用示例：</p>
 * <pre>
 * TypeSystem ts = new TypeSystem(RuntimeOptions.quiet());
 *
 * RuntimeOptions options = RuntimeOptions.builder()
 *     .lazyMethodGroups(true)
 *     .coreLibraryAlias("corlib")
 *     .build();
 * </pre>
 */
public final class RuntimeOptions {

    private final boolean suppressInterfaceWarnings;
    private final boolean lazyMethodGroups;
    private final String coreLoadUnitName;
    private final Set<String> coreLibraryAliases;
    private final String rootTypeName;
    private final long signatureCacheSize;

    private RuntimeOptions(Builder builder) {
        this.suppressInterfaceWarnings = builder.suppressInterfaceWarnings;
        this.lazyMethodGroups = builder.lazyMethodGroups;
        this.coreLoadUnitName = builder.coreLoadUnitName;
        this.coreLibraryAliases = Collections.unmodifiableSet(new LinkedHashSet<>(builder.coreLibraryAliases));
        this.rootTypeName = builder.rootTypeName;
        this.signatureCacheSize = builder.signatureCacheSize;
    }

    // ============ 预定义工厂方法 ============

    /** 默认配置 */
    public static RuntimeOptions defaults() {
        return builder().build();
    }

    /** 不报告缺失的接口成员（移植不完整的库时使用） */
    public static RuntimeOptions quiet() {
        return builder().suppressInterfaceWarnings(true).build();
    }

    /** 方法组在首次查找时才生成 */
    public static RuntimeOptions lazy() {
        return builder().lazyMethodGroups(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ============ Getter ============

    public boolean isSuppressInterfaceWarnings() { return suppressInterfaceWarnings; }
    public boolean isLazyMethodGroups() { return lazyMethodGroups; }
    public String getCoreLoadUnitName() { return coreLoadUnitName; }
    public Set<String> getCoreLibraryAliases() { return coreLibraryAliases; }
    public String getRootTypeName() { return rootTypeName; }
    public long getSignatureCacheSize() { return signatureCacheSize; }

    /** 该加载单元名是否与核心库共用标识 */
    public boolean isCoreAlias(String loadUnitName) {
        return coreLibraryAliases.contains(loadUnitName);
    }

    // ============ Builder ============

    public static final class Builder {
        private boolean suppressInterfaceWarnings = false;
        private boolean lazyMethodGroups = false;
        private String coreLoadUnitName = "IlHost.Core";
        private final Set<String> coreLibraryAliases = new LinkedHashSet<>(Collections.singleton("mscorlib"));
        private String rootTypeName = "System.Object";
        private long signatureCacheSize = 4096;

        private Builder() {
        }

        public Builder suppressInterfaceWarnings(boolean suppress) {
            this.suppressInterfaceWarnings = suppress;
            return this;
        }

        public Builder lazyMethodGroups(boolean lazy) {
            this.lazyMethodGroups = lazy;
            return this;
        }

        public Builder coreLoadUnitName(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("coreLoadUnitName must not be empty");
            }
            this.coreLoadUnitName = name;
            return this;
        }

        public Builder coreLibraryAlias(String alias) {
            this.coreLibraryAliases.add(alias);
            return this;
        }

        public Builder clearCoreLibraryAliases() {
            this.coreLibraryAliases.clear();
            return this;
        }

        public Builder rootTypeName(String name) {
            this.rootTypeName = name;
            return this;
        }

        public Builder signatureCacheSize(long size) {
            if (size <= 0) {
                throw new IllegalArgumentException("signatureCacheSize must be positive");
            }
            this.signatureCacheSize = size;
            return this;
        }

        public RuntimeOptions build() {
            return new RuntimeOptions(this);
        }
    }
}
