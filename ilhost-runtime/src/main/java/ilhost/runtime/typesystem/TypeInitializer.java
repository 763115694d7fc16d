package ilhost.runtime.typesystem;

import ilhost.runtime.Invokable;
import ilhost.runtime.TypeInitializationException;
import ilhost.runtime.types.FieldRecord;
import ilhost.runtime.types.MemberRecord;
import ilhost.runtime.types.PublicInterface;
import ilhost.runtime.types.TypeDescriptor;
import ilhost.runtime.types.TypeKind;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 类型初始化：方法组、接口修正、字段默认值、可赋值集合、附加初始化器、静态构造器。
 *
 * <p>先标记为已初始化再执行后续步骤，所以初始化过程中的自引用不会重入。
 * 完成后依次初始化已有的闭包实例化和基类。任何一步失败都记在描述符上并报告给宿主，
 * 之后每次初始化请求都重新抛出 {@link TypeInitializationException}。</p>
 */
final class TypeInitializer {

    private static final Logger LOG = Logger.getLogger(TypeInitializer.class.getName());

    private static final List<String> STATIC_CONSTRUCTORS =
            Arrays.asList("_cctor", "_cctor2", "_cctor3", "_cctor4", "_cctor5");
    private static final Object[] NO_ARGS = new Object[0];

    private final TypeSystem system;

    TypeInitializer(TypeSystem system) {
        this.system = system;
    }

    void initialize(TypeDescriptor type) {
        if (type.isInitialized()) {
            checkFailure(type);
            return;
        }
        system.lock().lock();
        try {
            if (type.isInitialized()) {
                checkFailure(type);
                return;
            }
            // 先标记，初始化过程中的自引用直接返回
            type.markInitialized();
            try {
                initializeMembers(type);
                for (TypeDescriptor closed : type.getClosedTypes().values()) {
                    initialize(closed);
                }
                if (type.getBaseType() != null) {
                    initialize(type.getBaseType());
                }
            } catch (RuntimeException e) {
                type.markInitializationFailed(e);
                LOG.log(Level.SEVERE, "Initialization of " + type.getFullName() + " failed", e);
                system.host().error(e);
                throw new TypeInitializationException(type.getFullName(), e);
            }
        } finally {
            system.lock().unlock();
        }
    }

    private void initializeMembers(TypeDescriptor type) {
        PublicInterface pi = type.getPublicInterface();
        if (type.isClosed()) {
            TypeKind kind = type.getKind();
            if (kind != TypeKind.INTERFACE && kind != TypeKind.ENUM && kind != TypeKind.ANY) {
                system.methodGroups().build(type);
            }
            if (!type.isInterface()) {
                system.interfaceFixup().fixup(type);
            }
            initializeFields(type, pi);
            if (type.getAssignableTypes() == null) {
                type.setAssignableTypes(system.assignability().buildAssignableSet(type));
            }
        }

        for (Consumer<PublicInterface> initializer : type.getInitializers()) {
            initializer.accept(pi);
        }

        if (type.isClosed() && !type.isInterface()) {
            runStaticConstructors(type, pi);
        }
        LOG.fine("Initialized " + type.getFullName());
    }

    private static void checkFailure(TypeDescriptor type) {
        if (type.getInitializationFailure() != null) {
            throw new TypeInitializationException(type.getFullName(), type.getInitializationFailure());
        }
    }

    private void initializeFields(TypeDescriptor type, PublicInterface pi) {
        for (MemberRecord record : type.getMembers()) {
            if (!(record instanceof FieldRecord)) continue;
            FieldRecord field = (FieldRecord) record;
            if (field.isConstant()) continue;
            String key = field.getDescriptor().getEscapedName();

            Object value;
            if (field.getDefaultValue() != null) {
                value = field.getDefaultValue().apply(pi);
            } else {
                TypeDescriptor fieldType = system.closure().resolveDescriptor(field.getFieldType(), type);
                // 结构字段在构造实例时逐个创建
                if (!field.isStatic() && fieldType != null && fieldType.getKind() == TypeKind.STRUCT
                        && !system.checks().hasPrimitiveDefault(fieldType)) continue;
                value = system.checks().defaultValue(fieldType);
            }
            if (field.isStatic()) {
                pi.getStatics().define(key, value);
            } else {
                pi.getTemplate().define(key, value);
            }
        }
    }

    /** 静态构造器的异常报告给宿主，不中断初始化 */
    private void runStaticConstructors(TypeDescriptor type, PublicInterface pi) {
        for (String name : STATIC_CONSTRUCTORS) {
            Object cctor = pi.getStatics().lookup(name);
            if (!(cctor instanceof Invokable)) continue;
            try {
                ((Invokable) cctor).invoke(pi, NO_ARGS);
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Static constructor " + name + " of " + type.getFullName() + " failed", e);
                system.host().error(new TypeInitializationException(type.getFullName(), e));
            }
        }
    }
}
