package com.simsci.cvd.io;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.risk.BinnedExposure;
import com.simsci.cvd.risk.CategoricalExposure;
import com.simsci.cvd.risk.CategoricalRelativeRisk;
import com.simsci.cvd.risk.ExposureModel;
import com.simsci.cvd.risk.LogLinearRelativeRisk;
import com.simsci.cvd.risk.LogNormalExposure;
import com.simsci.cvd.risk.NormalExposure;
import com.simsci.cvd.risk.RelativeRiskFunction;
import com.simsci.cvd.risk.RiskFactor;
import com.simsci.cvd.risk.RiskKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.simsci.cvd.io.ModelCompiler.getBoolean;
import static com.simsci.cvd.io.ModelCompiler.getDouble;
import static com.simsci.cvd.io.ModelCompiler.getString;
import static com.simsci.cvd.io.ModelCompiler.ref;

/**
 * Registry mapping {@link ComponentType}s to the factories that build exposure
 * models and relative-risk functions from their JSON properties.
 */
public final class ComponentRegistry {

    /** Builds a risk factor from its definition and the properties of its exposure component. */
    @FunctionalInterface
    public interface RiskFactory {
        RiskFactor create(String riskId, ModelDefinition.RiskDef def, Map<String, Object> properties);
    }

    /** Builds a relative-risk function from its component properties. */
    @FunctionalInterface
    public interface RelativeRiskFactory {
        RelativeRiskFunction create(Map<String, Object> properties);
    }

    private final Map<ComponentType, RiskFactory> riskFactories = new EnumMap<>(ComponentType.class);
    private final Map<ComponentType, RelativeRiskFactory> relativeRiskFactories = new EnumMap<>(ComponentType.class);

    public ComponentRegistry() {
        registerBuiltIns();
    }

    public void registerRisk(ComponentType type, RiskFactory factory) {
        if (!type.isExposure())
            throw new IllegalArgumentException(type + " is not an exposure component");
        riskFactories.put(type, factory);
    }

    public void registerRelativeRisk(ComponentType type, RelativeRiskFactory factory) {
        if (type.isExposure())
            throw new IllegalArgumentException(type + " is not a relative-risk component");
        relativeRiskFactories.put(type, factory);
    }

    public RiskFactory riskFactory(ComponentType type) {
        RiskFactory f = riskFactories.get(type);
        if (f == null)
            throw new ConfigurationException("No exposure factory for type " + type.key());
        return f;
    }

    public RelativeRiskFactory relativeRiskFactory(ComponentType type) {
        RelativeRiskFactory f = relativeRiskFactories.get(type);
        if (f == null)
            throw new ConfigurationException("No relative-risk factory for type " + type.key());
        return f;
    }

    // ── Built-in factories ──────────────────────────────────────────

    private void registerBuiltIns() {
        registerRisk(ComponentType.NORMAL, (id, def, p) -> continuous(id, def,
                new NormalExposure(ref(p, "mean"), ref(p, "sd"))));
        registerRisk(ComponentType.LOGNORMAL, (id, def, p) -> continuous(id, def,
                new LogNormalExposure(ref(p, "mean"), ref(p, "sd"))));
        registerRisk(ComponentType.CATEGORICAL, ComponentRegistry::categorical);
        registerRisk(ComponentType.BINNED, ComponentRegistry::binned);

        registerRelativeRisk(ComponentType.LOG_LINEAR, p -> new LogLinearRelativeRisk(ref(p, "rr_per_unit"),
                getDouble(p, "unit", 1.0), getBoolean(p, "floor_at_one", true)));
        registerRelativeRisk(ComponentType.CATEGORICAL_RR, p -> new CategoricalRelativeRisk(
                refMap(p, "relative_risks")));
    }

    private static RiskFactor continuous(String id, ModelDefinition.RiskDef def, ExposureModel model) {
        RiskKind kind = RiskKind.fromString(def.getKind());
        if (!kind.isContinuous())
            throw new ConfigurationException("Risk " + id + " is " + kind + " but has a continuous exposure model");
        return new RiskFactor(id, kind, model, null, def.getFloor(), def.getCeiling(), def.getTmrel(),
                null, null, null);
    }

    private static RiskFactor categorical(String id, ModelDefinition.RiskDef def, Map<String, Object> p) {
        List<String> categories = requireCategories(id, def);
        Map<String, DataRef> byCategory = refMap(p, "probabilities");
        List<DataRef> ordered = new ArrayList<>(categories.size());
        for (String c : categories) {
            DataRef r = byCategory.get(c);
            if (r == null)
                throw new ConfigurationException("Risk " + id + " has no probability for category " + c);
            ordered.add(r);
        }
        return RiskFactor.categorical(id, new CategoricalExposure(ordered), categories, def.getReferenceCategory());
    }

    private static RiskFactor binned(String id, ModelDefinition.RiskDef def, Map<String, Object> p) {
        String parent = getString(p, "parent", null);
        if (parent == null)
            throw new ConfigurationException("Binned risk " + id + " names no parent risk");
        Object raw = p.get("thresholds");
        if (!(raw instanceof List<?> list) || list.isEmpty())
            throw new ConfigurationException("Binned risk " + id + " needs a non-empty thresholds list");
        double[] thresholds = new double[list.size()];
        for (int i = 0; i < thresholds.length; i++) {
            Object v = list.get(i);
            thresholds[i] = v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
        }
        return RiskFactor.binned(id, new BinnedExposure(parent, thresholds), requireCategories(id, def),
                def.getReferenceCategory());
    }

    private static List<String> requireCategories(String id, ModelDefinition.RiskDef def) {
        if (def.getCategories() == null || def.getCategories().isEmpty())
            throw new ConfigurationException("Categorical risk " + id + " declares no categories");
        return def.getCategories();
    }

    private static Map<String, DataRef> refMap(Map<String, Object> p, String key) {
        Object raw = p.get(key);
        if (!(raw instanceof Map<?, ?> m))
            throw new ConfigurationException("Property '" + key + "' must be an object");
        Map<String, DataRef> out = new LinkedHashMap<>();
        for (var e : m.entrySet())
            out.put(String.valueOf(e.getKey()), DataRef.parse(e.getValue()));
        return out;
    }
}
