package ilhost.runtime.typesystem;

import ilhost.runtime.Host;
import ilhost.runtime.RuntimeOptions;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.MemberFlags;

/**
 * 测试用的最小核心库：根类型、值类型基类、常用基元与反射类型链。
 */
public final class CoreLibrary {

    private CoreLibrary() {}

    public static TypeSystem newSystem(Host host) {
        return newSystem(RuntimeOptions.defaults(), host);
    }

    public static TypeSystem newSystem(RuntimeOptions options, Host host) {
        TypeSystem ts = new TypeSystem(options, host);
        declare(ts);
        return ts;
    }

    public static void declare(TypeSystem ts) {
        LoadUnit core = ts.coreUnit();
        ts.makeClass(core, "System.Object", null, $ -> {
            $.method(MemberFlags.PUBLIC_INSTANCE, "ToString", $.signature("System.String"),
                    (self, args) -> "System.Object");
            $.constructor($.signature(null), (self, args) -> null);
        });
        ts.makeClass(core, "System.ValueType", null, null);
        ts.makeClass(core, "System.Enum", null, null);
        ts.makeClass(core, "System.Array", null, null);
        ts.makeClass(core, "System.String", null, null);
        ts.makeStruct(core, "System.Int32", null);
        ts.makeStruct(core, "System.Int64", null);
        ts.makeStruct(core, "System.Double", null);
        ts.makeStruct(core, "System.Boolean", null);
        ts.makeClass(core, "System.Delegate", null, null);
        ts.makeClass(core, "System.MulticastDelegate", "System.Delegate", null);
        ts.makeClass(core, "System.Reflection.MemberInfo", null, null);
        ts.makeClass(core, "System.Type", "System.Reflection.MemberInfo", null);
        ts.makeClass(core, "System.RuntimeType", "System.Type", null);
    }
}
