package work.lcod.bridge.support;

import java.util.ArrayList;
import java.util.List;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.resolve.InMemoryObjectGraph;
import work.lcod.bridge.resolve.TypeCatalog;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.EnumType;
import work.lcod.bridge.types.EnumValue;
import work.lcod.bridge.types.PrimitiveType;
import work.lcod.bridge.types.ReferenceType;
import work.lcod.bridge.types.SequenceType;

/**
 * Shared fixtures for bridge test suites: a small scene of lights and nodes with their
 * member tables registered in a {@link TypeCatalog}.
 */
public final class BridgeTestSupport {
    public static final EnumType LIGHT_MODE = EnumType.sequential("LightMode", "Directional", "Point", "Spot");

    public static final CompositeType COLOR = CompositeType.builder("Color", Color.class, Color::new)
        .valueSemantics(true)
        .property("r", PrimitiveType.FLOAT, Color::getR, Color::setR)
        .property("g", PrimitiveType.FLOAT, Color::getG, Color::setG)
        .property("b", PrimitiveType.FLOAT, Color::getB, Color::setB)
        .property("a", PrimitiveType.FLOAT, Color::getA, Color::setA)
        .build();

    public static final CompositeType NODE = CompositeType.builder("SceneNode", SceneNode.class, SceneNode::new)
        .property("name", PrimitiveType.STRING, SceneNode::getName, SceneNode::setName)
        .build();

    public static final CompositeType LIGHT = CompositeType.builder("Light", Light.class, Light::new)
        .property("name", PrimitiveType.STRING, Light::getName, Light::setName)
        .property("intensity", PrimitiveType.FLOAT, Light::getIntensity, Light::setIntensity)
        .property("range", PrimitiveType.INT, Light::getRange, Light::setRange)
        .property("enabled", PrimitiveType.BOOL, Light::isEnabled, Light::setEnabled)
        .property("mode", LIGHT_MODE, Light::getMode, Light::setMode)
        .property("color", COLOR, Light::getColor, Light::setColor)
        .property("target", ReferenceType.of(SceneNode.class), Light::getTarget, Light::setTarget)
        .property("tags", SequenceType.listOf(PrimitiveType.STRING), Light::getTags, Light::setTags)
        .property("exposure", PrimitiveType.DOUBLE, Light::getExposure, Light::setExposure)
        .readOnlyProperty("id", PrimitiveType.STRING, Light::getId)
        .serializedField("shadowBias", PrimitiveType.FLOAT, Light::getShadowBias, Light::setShadowBias)
        .field("cacheSlot", PrimitiveType.INT, false, Light::getCacheSlot, Light::setCacheSlot)
        .build();

    private BridgeTestSupport() {}

    public static TypeCatalog catalog() {
        return new TypeCatalog()
            .register(LIGHT_MODE)
            .register(COLOR)
            .register(NODE)
            .register(LIGHT);
    }

    /**
     * Graph with {@code count} lights under {@code Scene/Lights/Light<n>} (ids {@code light-<n>})
     * and one node at {@code Scene/Pivot} (id {@code pivot}).
     */
    public static InMemoryObjectGraph scene(int count) {
        var graph = new InMemoryObjectGraph();
        for (int i = 0; i < count; i++) {
            var light = new Light();
            light.setName("Light" + i);
            graph.add("Scene/Lights/Light" + i, "light-" + i, light);
        }
        var pivot = new SceneNode();
        pivot.setName("Pivot");
        graph.add("Scene/Pivot", "pivot", pivot);
        return graph;
    }

    public static BridgeContext context(InMemoryObjectGraph graph) {
        return BridgeContext.builder()
            .liveObjects(graph)
            .types(catalog())
            .build();
    }

    public static final class Color {
        private float r;
        private float g;
        private float b;
        private float a = 1f;

        public float getR() {
            return r;
        }

        public void setR(float r) {
            this.r = r;
        }

        public float getG() {
            return g;
        }

        public void setG(float g) {
            this.g = g;
        }

        public float getB() {
            return b;
        }

        public void setB(float b) {
            this.b = b;
        }

        public float getA() {
            return a;
        }

        public void setA(float a) {
            this.a = a;
        }
    }

    public static final class SceneNode {
        private String name;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static final class Light {
        private final String id = "fixed-id";
        private String name;
        private float intensity = 1f;
        private int range = 10;
        private boolean enabled = true;
        private EnumValue mode = LIGHT_MODE.raw(1);
        private Color color = new Color();
        private SceneNode target;
        private List<String> tags = new ArrayList<>();
        private double exposure;
        private float shadowBias = 0.05f;
        private int cacheSlot;

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public float getIntensity() {
            return intensity;
        }

        public void setIntensity(float intensity) {
            this.intensity = intensity;
        }

        public int getRange() {
            return range;
        }

        public void setRange(int range) {
            this.range = range;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public EnumValue getMode() {
            return mode;
        }

        public void setMode(EnumValue mode) {
            this.mode = mode;
        }

        public Color getColor() {
            return color;
        }

        public void setColor(Color color) {
            this.color = color;
        }

        public SceneNode getTarget() {
            return target;
        }

        public void setTarget(SceneNode target) {
            this.target = target;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }

        public double getExposure() {
            return exposure;
        }

        /**
         * Rejects negative exposure.
         */
        public void setExposure(double exposure) {
            if (exposure < 0) {
                throw new IllegalArgumentException("exposure must not be negative");
            }
            this.exposure = exposure;
        }

        public float getShadowBias() {
            return shadowBias;
        }

        public void setShadowBias(float shadowBias) {
            this.shadowBias = shadowBias;
        }

        public int getCacheSlot() {
            return cacheSlot;
        }

        public void setCacheSlot(int cacheSlot) {
            this.cacheSlot = cacheSlot;
        }
    }
}
