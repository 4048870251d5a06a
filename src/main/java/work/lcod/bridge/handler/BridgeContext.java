package work.lcod.bridge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import work.lcod.bridge.api.BridgeConfiguration;
import work.lcod.bridge.api.BridgeConfigurationLoader;
import work.lcod.bridge.batch.BatchExecutor;
import work.lcod.bridge.coerce.CoercionEngine;
import work.lcod.bridge.coerce.ValueSerializer;
import work.lcod.bridge.member.MemberApplier;
import work.lcod.bridge.resolve.AssetResolver;
import work.lcod.bridge.resolve.LiveObjectResolver;
import work.lcod.bridge.resolve.TypeCatalog;
import work.lcod.bridge.resolve.TypeResolver;

/**
 * Collaborators shared by every handler of one bridge: resolvers, coercion, member and batch helpers.
 */
public final class BridgeContext {
    private final BridgeConfiguration configuration;
    private final LiveObjectResolver liveObjects;
    private final AssetResolver assets;
    private final TypeResolver types;
    private final SideEffectWaiter sideEffects;
    private final ObjectMapper json;
    private final CoercionEngine coercion;
    private final ValueSerializer serializer;
    private final MemberApplier members;
    private final BatchExecutor batch;

    private BridgeContext(Builder builder) {
        this.configuration = builder.configuration == null ? BridgeConfigurationLoader.loadDefault() : builder.configuration;
        this.liveObjects = builder.liveObjects == null ? LiveObjectResolver.NONE : builder.liveObjects;
        this.assets = builder.assets == null ? AssetResolver.NONE : builder.assets;
        this.types = builder.types == null ? new TypeCatalog() : builder.types;
        this.sideEffects = builder.sideEffects == null ? SideEffectWaiter.NONE : builder.sideEffects;
        this.json = builder.json == null ? new ObjectMapper() : builder.json;
        this.coercion = builder.coercion == null
            ? CoercionEngine.builder().liveObjects(liveObjects).assets(assets).objectMapper(json).build()
            : builder.coercion;
        this.serializer = new ValueSerializer(liveObjects, types, json);
        this.members = new MemberApplier(types, coercion);
        this.batch = new BatchExecutor(liveObjects, configuration.defaultMaxResults());
    }

    public static Builder builder() {
        return new Builder();
    }

    public BridgeConfiguration configuration() {
        return configuration;
    }

    public LiveObjectResolver liveObjects() {
        return liveObjects;
    }

    public AssetResolver assets() {
        return assets;
    }

    public TypeResolver types() {
        return types;
    }

    public SideEffectWaiter sideEffects() {
        return sideEffects;
    }

    public ObjectMapper json() {
        return json;
    }

    public CoercionEngine coercion() {
        return coercion;
    }

    public ValueSerializer serializer() {
        return serializer;
    }

    public MemberApplier members() {
        return members;
    }

    public BatchExecutor batch() {
        return batch;
    }

    public static final class Builder {
        private BridgeConfiguration configuration;
        private LiveObjectResolver liveObjects;
        private AssetResolver assets;
        private TypeResolver types;
        private SideEffectWaiter sideEffects;
        private ObjectMapper json;
        private CoercionEngine coercion;

        public Builder configuration(BridgeConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder liveObjects(LiveObjectResolver liveObjects) {
            this.liveObjects = liveObjects;
            return this;
        }

        public Builder assets(AssetResolver assets) {
            this.assets = assets;
            return this;
        }

        public Builder types(TypeResolver types) {
            this.types = types;
            return this;
        }

        public Builder sideEffects(SideEffectWaiter sideEffects) {
            this.sideEffects = sideEffects;
            return this;
        }

        public Builder json(ObjectMapper json) {
            this.json = json;
            return this;
        }

        /**
         * Replaces the standard coercion engine, e.g. to add converters.
         */
        public Builder coercion(CoercionEngine coercion) {
            this.coercion = coercion;
            return this;
        }

        public BridgeContext build() {
            return new BridgeContext(this);
        }
    }
}
