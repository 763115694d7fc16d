package ilhost.runtime.typesystem.reflect;

import ilhost.runtime.IlHostException;
import ilhost.runtime.Invokable;
import ilhost.runtime.types.IlObject;
import ilhost.runtime.types.MemberTable;
import ilhost.runtime.types.MethodSignature;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeReference;
import ilhost.runtime.typesystem.ResolvedMethod;
import ilhost.runtime.typesystem.TypeSystem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 反射方法：签名已在声明类型的泛型绑定下替换。
 */
public class MethodInfo extends MemberInfo {

    private final ResolvedMethod method;
    private volatile List<ParameterInfo> parameters;

    MethodInfo(TypeSystem system, ResolvedMethod method) {
        super(system, method.getContext(), method.getRecord());
        this.method = method;
    }

    public ResolvedMethod getResolvedMethod() {
        return method;
    }

    public MethodSignature getSignature() {
        return method.getSignature();
    }

    /** 无返回值时为 null */
    public TypeDescriptor getReturnType() {
        TypeReference returnType = method.getSignature().getReturnType();
        return returnType == null ? null : system.resolveType(returnType, getDeclaringType());
    }

    public List<ParameterInfo> getParameters() {
        List<ParameterInfo> result = parameters;
        if (result == null) {
            List<TypeReference> types = method.getSignature().getArgumentTypes();
            List<ParameterInfo> list = new ArrayList<>(types.size());
            for (int i = 0; i < types.size(); i++) {
                list.add(new ParameterInfo(i, types.get(i)));
            }
            result = Collections.unmodifiableList(list);
            parameters = result;
        }
        return result;
    }

    public boolean isGenericMethod() {
        return method.getSignature().isGeneric();
    }

    public boolean isPlaceholder() {
        return method.getRecord().isPlaceholder();
    }

    /**
     * 调用：实例方法在目标实例的模板上按修饰名查找（得到最终的重写），
     * 静态方法在声明类型的静态表上查找。
     */
    public Object invoke(Object target, Object... args) {
        PublicInterface pi = getDeclaringType().getPublicInterface();
        String key = method.getTableKey();
        Object implementation;
        Object self;
        if (isStatic()) {
            implementation = pi.getStatics().lookup(key);
            self = pi;
        } else {
            if (target == null) {
                throw new IlHostException("Non-static method '" + getName() + "' requires a target");
            }
            MemberTable table = target instanceof IlObject ? ((IlObject) target).getTemplate() : pi.getTemplate();
            implementation = table.lookup(key);
            if (implementation == null) implementation = pi.getTemplate().lookup(key);
            self = target;
        }
        if (!(implementation instanceof Invokable)) {
            throw new IlHostException("No implementation was found for " + method.describe());
        }
        return ((Invokable) implementation).invoke(self, args);
    }

    @Override
    public String toString() {
        return method.describe();
    }
}
