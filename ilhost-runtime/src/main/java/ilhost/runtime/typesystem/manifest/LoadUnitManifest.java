package ilhost.runtime.typesystem.manifest;

import java.util.ArrayList;
import java.util.List;

/**
 * 清单根对象：一个加载单元及其声明的类型。
 */
public final class LoadUnitManifest {

    private String loadUnit;
    private List<TypeManifest> types = new ArrayList<>();

    public String getLoadUnit() {
        return loadUnit;
    }

    public List<TypeManifest> getTypes() {
        return types == null ? new ArrayList<TypeManifest>() : types;
    }
}
