package ilhost.runtime.typesystem;

import ilhost.runtime.AmbiguousTypeException;
import ilhost.runtime.types.LoadUnit;
import ilhost.runtime.types.PublicInterface;

import java.util.ArrayList;
import java.util.List;

/**
 * 多个加载单元都公开声明了同一名称时，全局查找得到的哨兵句柄。
 */
final class AmbiguousTypeHandle implements TypeHandle {

    private final String name;
    private final List<LoadUnit> owners;

    AmbiguousTypeHandle(String name, List<LoadUnit> owners) {
        this.name = name;
        this.owners = new ArrayList<>(owners);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public LoadUnit getLoadUnit() {
        return null;
    }

    @Override
    public BindingState getState() {
        return BindingState.UNCONSTRUCTED;
    }

    @Override
    public PublicInterface get() {
        return get(true);
    }

    @Override
    public PublicInterface get(boolean initialize) {
        throw new AmbiguousTypeException("Type '" + name + "' has multiple public definitions. "
                + "You must access it through a specific assembly.");
    }

    List<LoadUnit> getOwners() {
        return owners;
    }

    AmbiguousTypeHandle withOwner(LoadUnit unit) {
        AmbiguousTypeHandle result = new AmbiguousTypeHandle(name, owners);
        result.owners.add(unit);
        return result;
    }
}
