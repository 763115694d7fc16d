package ilhost.runtime.typesystem.manifest;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个类型的清单条目。类型引用为字符串，泛型写作 {@code Name<Arg1, Arg2>}，
 * {@code !T} 为本类型的泛型参数，{@code !!0} 为方法的泛型参数。
 */
public final class TypeManifest {

    private String name;
    private String kind = "class";
    @SerializedName("public")
    private Boolean isPublic;
    private String base;
    private List<String> genericParameters = new ArrayList<>();
    private List<String> interfaces = new ArrayList<>();
    private List<MemberManifest> fields = new ArrayList<>();
    private List<MemberManifest> constants = new ArrayList<>();
    private List<MemberManifest> methods = new ArrayList<>();
    private List<MemberManifest> properties = new ArrayList<>();
    private List<MemberManifest> interfaceMethods = new ArrayList<>();
    private List<String> interfaceProperties = new ArrayList<>();
    private Map<String, Long> enumMembers = new LinkedHashMap<>();
    private boolean flags;

    public String getName() { return name; }
    public String getKind() { return kind; }
    public boolean isPublic() { return isPublic == null || isPublic; }
    public String getBase() { return base; }
    public List<String> getGenericParameters() { return orEmpty(genericParameters); }
    public List<String> getInterfaces() { return orEmpty(interfaces); }
    public List<MemberManifest> getFields() { return orEmpty(fields); }
    public List<MemberManifest> getConstants() { return orEmpty(constants); }
    public List<MemberManifest> getMethods() { return orEmpty(methods); }
    public List<MemberManifest> getProperties() { return orEmpty(properties); }
    public List<MemberManifest> getInterfaceMethods() { return orEmpty(interfaceMethods); }
    public List<String> getInterfaceProperties() { return orEmpty(interfaceProperties); }
    public Map<String, Long> getEnumMembers() { return enumMembers == null ? new LinkedHashMap<String, Long>() : enumMembers; }
    public boolean isFlags() { return flags; }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? new ArrayList<T>() : list;
    }
}
