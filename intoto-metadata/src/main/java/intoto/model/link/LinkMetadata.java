package intoto.model.link;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import intoto.model.Metadata;
import intoto.model.TargetPath;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * in-toto link: what one step of a supply chain consumed (materials), what it
 * produced (products), and the environment and byproducts of running it.
 * <p>
 * Encoded with {@code "_type": "link"}; decoding a document labeled with any
 * other type fails. Links carry no version number, so {@link #version()} is 0.
 */
@JsonPropertyOrder({"_type", "name", "materials", "products", "env", "byproducts"})
public final class LinkMetadata implements Metadata {

    public static final String TYPE = "link";

    private final String name;
    private final SortedMap<TargetPath, TargetDescription> materials;
    private final SortedMap<TargetPath, TargetDescription> products;
    private final SortedMap<String, String> env;
    private final SortedMap<String, String> byproducts;

    public LinkMetadata(String name,
                        Map<TargetPath, TargetDescription> materials,
                        Map<TargetPath, TargetDescription> products,
                        Map<String, String> env,
                        Map<String, String> byproducts) {
        this.name = Objects.requireNonNull(name, "name");
        this.materials = sorted(materials);
        this.products = sorted(products);
        this.env = sorted(env);
        this.byproducts = sorted(byproducts);
    }

    @JsonCreator
    static LinkMetadata fromJson(@JsonProperty(value = "_type", required = true) String type,
                                 @JsonProperty(value = "name", required = true) String name,
                                 @JsonProperty("materials") Map<TargetPath, TargetDescription> materials,
                                 @JsonProperty("products") Map<TargetPath, TargetDescription> products,
                                 @JsonProperty("env") Map<String, String> env,
                                 @JsonProperty("byproducts") Map<String, String> byproducts) {
        if (!TYPE.equals(type)) {
            throw new IllegalArgumentException("Attempted to decode link metadata labeled as " + type);
        }
        return new LinkMetadata(name, materials, products, env, byproducts);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @JsonProperty("_type")
    public String type() {
        return TYPE;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("materials")
    public SortedMap<TargetPath, TargetDescription> materials() {
        return materials;
    }

    @JsonProperty("products")
    public SortedMap<TargetPath, TargetDescription> products() {
        return products;
    }

    @JsonProperty("env")
    public SortedMap<String, String> env() {
        return env;
    }

    @JsonProperty("byproducts")
    public SortedMap<String, String> byproducts() {
        return byproducts;
    }

    @Override
    public int version() {
        return 0;
    }

    private static <K, V> SortedMap<K, V> sorted(Map<K, V> map) {
        return map == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(map));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LinkMetadata other
                && name.equals(other.name)
                && materials.equals(other.materials)
                && products.equals(other.products)
                && env.equals(other.env)
                && byproducts.equals(other.byproducts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, materials, products, env, byproducts);
    }

    @Override
    public String toString() {
        return "LinkMetadata{name=" + name + ", materials=" + materials.keySet()
                + ", products=" + products.keySet() + "}";
    }

    /**
     * Accumulates the parts of a link before it is built.
     */
    public static final class Builder {

        private final String name;
        private final Map<TargetPath, TargetDescription> materials = new TreeMap<>();
        private final Map<TargetPath, TargetDescription> products = new TreeMap<>();
        private final Map<String, String> env = new TreeMap<>();
        private final Map<String, String> byproducts = new TreeMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder material(TargetPath path, TargetDescription description) {
            materials.put(path, description);
            return this;
        }

        public Builder product(TargetPath path, TargetDescription description) {
            products.put(path, description);
            return this;
        }

        public Builder env(String key, String value) {
            env.put(key, value);
            return this;
        }

        public Builder byproduct(String key, String value) {
            byproducts.put(key, value);
            return this;
        }

        public LinkMetadata build() {
            return new LinkMetadata(name, materials, products, env, byproducts);
        }
    }
}
