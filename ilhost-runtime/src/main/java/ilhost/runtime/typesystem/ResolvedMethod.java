package ilhost.runtime.typesystem;

import ilhost.runtime.types.MethodRecord;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.TypeDescriptor;

/**
 * 方法记录连同找到它的类型，以及在该类型泛型绑定下替换后的签名。
 */
public final class ResolvedMethod {

    private final MethodRecord record;
    private final TypeDescriptor context;
    private final MethodSignature signature;

    ResolvedMethod(MethodRecord record, TypeDescriptor context, MethodSignature signature) {
        this.record = record;
        this.context = context;
        this.signature = signature;
    }

    public MethodRecord getRecord() {
        return record;
    }

    /** 继承链上声明（或闭包出）该方法的类型 */
    public TypeDescriptor getContext() {
        return context;
    }

    public MethodSignature getSignature() {
        return signature;
    }

    public String getName() {
        return record.getName();
    }

    /** 成员表中的实际键，闭包改名后为新修饰名 */
    public String getTableKey() {
        String mangled = record.getMangledName();
        String renamed = context.getRenamedMethods().get(mangled);
        return renamed != null ? renamed : mangled;
    }

    public String describe() {
        return signature.describe(context.getFullName() + "::" + record.getName());
    }

    @Override
    public String toString() {
        return describe();
    }
}
