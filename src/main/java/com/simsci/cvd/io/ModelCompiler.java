package com.simsci.cvd.io;

import com.simsci.cvd.api.ConfigurationException;
import com.simsci.cvd.api.ResourceLimits;
import com.simsci.cvd.engine.DiseaseStateMachine;
import com.simsci.cvd.engine.Simulation;
import com.simsci.cvd.engine.SimulationSettings;
import com.simsci.cvd.model.Cause;
import com.simsci.cvd.model.CauseGraph;
import com.simsci.cvd.model.CauseType;
import com.simsci.cvd.model.DataRef;
import com.simsci.cvd.model.DataType;
import com.simsci.cvd.model.RateName;
import com.simsci.cvd.model.Sex;
import com.simsci.cvd.model.State;
import com.simsci.cvd.model.Target;
import com.simsci.cvd.model.Transition;
import com.simsci.cvd.orchestrator.OrchestrationSettings;
import com.simsci.cvd.paf.AgeGroup;
import com.simsci.cvd.paf.PafAggregator;
import com.simsci.cvd.paf.PafMethod;
import com.simsci.cvd.paf.Stratification;
import com.simsci.cvd.rate.Interpolation;
import com.simsci.cvd.rate.RateResolver;
import com.simsci.cvd.rate.RateTable;
import com.simsci.cvd.risk.ExposureSampler;
import com.simsci.cvd.risk.RiskCatalog;
import com.simsci.cvd.risk.RiskCorrelation;
import com.simsci.cvd.risk.RiskEffect;
import com.simsci.cvd.risk.RiskEffectEngine;
import com.simsci.cvd.risk.RiskFactor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Compiles a {@link ModelDefinition} into the validated, immutable objects a
 * simulation runs on. Every structural problem surfaces here as a
 * {@link ConfigurationException}, before any simulant is created.
 */
public final class ModelCompiler {
    private static final Logger log = LogManager.getLogger(ModelCompiler.class);

    private final ComponentRegistry registry = new ComponentRegistry();

    /** Registry used to build exposure models and relative-risk functions; open for custom types. */
    public ComponentRegistry registry() {
        return registry;
    }

    public CompiledModel compile(ModelDefinition def) {
        SimulationSettings settings = settings(def.getSimulation());
        ModelDefinition.SimulationDef sim = def.getSimulation();
        Interpolation interpolation = new Interpolation(sim.getInterpolationOrder(), sim.isExtrapolate());

        // 1. Tables
        Map<String, RateTable> tables = new LinkedHashMap<>();
        for (var e : def.getTables().entrySet())
            tables.put(e.getKey(), table(e.getKey(), e.getValue()));
        RateResolver rates = new RateResolver(tables, interpolation);

        // 2. Causes
        if (def.getCauses().isEmpty())
            throw new ConfigurationException("Model declares no causes");
        List<CauseGraph> graphs = new ArrayList<>(def.getCauses().size());
        for (var e : def.getCauses().entrySet())
            graphs.add(CauseGraph.compile(cause(e.getKey(), e.getValue())));

        // 3. Risks and their joint sampling
        List<RiskFactor> factors = new ArrayList<>(def.getRisks().size());
        for (var e : def.getRisks().entrySet())
            factors.add(risk(e.getKey(), e.getValue()));
        RiskCatalog catalog = new RiskCatalog(factors);
        List<RiskCorrelation> correlations = new ArrayList<>();
        for (ModelDefinition.CorrelationDef c : def.getCorrelations())
            correlations.add(correlation(c));
        ExposureSampler sampler = new ExposureSampler(catalog, correlations);

        // 4. Effects
        List<RiskEffect> effects = new ArrayList<>(def.getEffects().size());
        for (ModelDefinition.EffectDef e : def.getEffects())
            effects.add(effect(e, graphs));
        RiskEffectEngine engine = new RiskEffectEngine(catalog, effects, rates);

        // 5. State machines
        Map<Target, String> pafTables = new HashMap<>();
        for (var e : def.getPafTables().entrySet()) {
            Target t = Target.parse(e.getKey());
            requireTarget(t, graphs, "PAF table " + e.getValue());
            pafTables.put(t, e.getValue());
        }
        List<DiseaseStateMachine> machines = new ArrayList<>(graphs.size());
        for (int c = 0; c < graphs.size(); c++)
            machines.add(new DiseaseStateMachine(c, graphs.get(c), rates, engine, pafTables, settings.rateUnitDays()));

        Stratification strata = stratification(def.getStratification(), settings);
        PafMethod method = PafMethod.fromString(sim.getPafMethod());
        OrchestrationSettings orchestration = orchestration(def.getOrchestration());

        log.info("Compiled model: {} tables, {} causes, {} risks, {} effects, {} cells, method {}", tables.size(),
                graphs.size(), catalog.size(), effects.size(), strata.cellCount(), method);
        return new CompiledModel(settings, rates, graphs, catalog, sampler, engine, machines, strata, method,
                orchestration);
    }

    private static SimulationSettings settings(ModelDefinition.SimulationDef s) {
        return SimulationSettings.builder()
                .populationSize(s.getPopulationSize())
                .ages(s.getAgeStart(), s.getAgeEnd())
                .startYear(s.getStartYear())
                .stepDays(s.getStepDays())
                .steps(s.getSteps())
                .rateUnitDays(s.getRateUnitDays())
                .seed(s.getSeed())
                .threads(s.getThreads())
                .chunkSize(s.getChunkSize())
                .build();
    }

    private static RateTable table(String key, List<ModelDefinition.TableRowDef> rows) {
        if (rows == null || rows.isEmpty())
            throw new ConfigurationException("Table '" + key + "' has no rows");
        RateTable.Builder b = RateTable.builder(key);
        for (ModelDefinition.TableRowDef r : rows) {
            String sex = r.getSex();
            if (sex == null || sex.equalsIgnoreCase("both")) {
                for (Sex s : Sex.values())
                    b.addRow(s, r.getAgeStart(), r.getAgeEnd(), r.getYearStart(), r.getYearEnd(), r.getValue());
            } else {
                b.addRow(Sex.fromString(sex), r.getAgeStart(), r.getAgeEnd(), r.getYearStart(), r.getYearEnd(),
                        r.getValue());
            }
        }
        return b.build();
    }

    private static Cause cause(String name, ModelDefinition.CauseDef def) {
        List<State> states = new ArrayList<>(def.getStates().size());
        for (var e : def.getStates().entrySet()) {
            ModelDefinition.StateDef sd = e.getValue() == null ? new ModelDefinition.StateDef() : e.getValue();
            states.add(State.builder(e.getKey())
                    .causeType(CauseType.fromString(sd.getCauseType()))
                    .isTransient(sd.isTransient())
                    .allowSelfTransition(sd.getAllowSelfTransition() == null || sd.getAllowSelfTransition())
                    .dwellTime(DataRef.parse(sd.getDwellTime()))
                    .disabilityWeight(DataRef.parse(sd.getDisabilityWeight()))
                    .excessMortalityRate(DataRef.parse(sd.getExcessMortalityRate()))
                    .build());
        }
        List<Transition> transitions = new ArrayList<>(def.getTransitions().size());
        for (var e : def.getTransitions().entrySet()) {
            ModelDefinition.TransitionDef td = e.getValue();
            DataType type = DataType.fromString(td.getDataType());
            Map<RateName, DataRef> sources = new EnumMap<>(RateName.class);
            if (td.getDataSources() != null)
                for (var s : td.getDataSources().entrySet())
                    sources.put(RateName.fromKey(s.getKey()), DataRef.parse(s.getValue()));
            if (type == DataType.DWELL_TIME && !sources.isEmpty())
                throw new ConfigurationException("Dwell-time transition " + e.getKey() + " cannot bind data sources");
            transitions.add(new Transition(e.getKey(), td.getSource(), td.getSink(), type, sources));
        }
        return new Cause(name, states, transitions, def.getInitialState());
    }

    private RiskFactor risk(String id, ModelDefinition.RiskDef def) {
        if (def.getExposure() == null)
            throw new ConfigurationException("Risk " + id + " has no exposure component");
        ComponentType type = ComponentType.fromString(def.getExposure().getType());
        if (!type.isExposure())
            throw new ConfigurationException("Risk " + id + " uses " + type.key() + " as an exposure model");
        RiskFactor f = registry.riskFactory(type).create(id, def, props(def.getExposure()));
        return def.getCorrelationGroup() == null ? f : f.inGroup(def.getCorrelationGroup());
    }

    private static RiskCorrelation correlation(ModelDefinition.CorrelationDef def) {
        if (def.getAgeBands() == null || def.getAgeBands().isEmpty())
            throw new ConfigurationException("Correlation group " + def.getGroup() + " has no age bands");
        List<RiskCorrelation.AgeBand> bands = new ArrayList<>(def.getAgeBands().size());
        for (ModelDefinition.AgeBandDef b : def.getAgeBands())
            bands.add(new RiskCorrelation.AgeBand(b.getAgeStart(), b.getAgeEnd(), b.getMatrix()));
        return new RiskCorrelation(def.getGroup(), def.getRisks(), bands);
    }

    private RiskEffect effect(ModelDefinition.EffectDef def, List<CauseGraph> graphs) {
        if (def.getTarget() == null || def.getRisk() == null)
            throw new ConfigurationException("Effect needs both a risk and a target");
        Target target = Target.parse(def.getTarget());
        requireTarget(target, graphs, "Effect of " + def.getRisk());
        if (def.getRelativeRisk() == null)
            throw new ConfigurationException("Effect of " + def.getRisk() + " on " + target + " has no relative_risk");
        ComponentType type = ComponentType.fromString(def.getRelativeRisk().getType());
        if (type.isExposure())
            throw new ConfigurationException("Effect of " + def.getRisk() + " uses " + type.key()
                    + " as a relative risk");
        return new RiskEffect(def.getRisk(), target,
                registry.relativeRiskFactory(type).create(props(def.getRelativeRisk())),
                def.getMediator(), def.getMediatorWeight());
    }

    private static void requireTarget(Target t, List<CauseGraph> graphs, String usedBy) {
        for (CauseGraph g : graphs) {
            if (!g.cause().equals(t.cause()))
                continue;
            Transition tr = g.transition(g.transitionIndex(t.transition()));
            if (tr.dataType() == DataType.DWELL_TIME || tr.rateName() != t.rateName())
                throw new ConfigurationException(usedBy + " targets " + t + " but the transition is driven by "
                        + (tr.rateName() == null ? "its dwell time" : tr.rateName().key()));
            return;
        }
        throw new ConfigurationException(usedBy + " targets unknown cause " + t.cause());
    }

    private static Stratification stratification(ModelDefinition.StratificationDef def, SimulationSettings s) {
        if (def == null || def.getAgeGroups() == null || def.getAgeGroups().isEmpty())
            return Stratification.single(s.ageStart(), s.ageEnd());
        List<AgeGroup> groups = new ArrayList<>(def.getAgeGroups().size());
        for (ModelDefinition.AgeGroupDef g : def.getAgeGroups())
            groups.add(new AgeGroup(g.getName(), g.getStart(), g.getEnd()));
        return new Stratification(groups);
    }

    private static OrchestrationSettings orchestration(ModelDefinition.OrchestrationDef o) {
        ResourceLimits limits = new ResourceLimits(o.getCpus(), o.getMemoryGb(),
                Duration.ofMinutes(o.getWallClockMinutes()));
        return new OrchestrationSettings(o.getVersion(), o.getDrawCount(), o.getLocations(), limits,
                Duration.ofMillis(o.getPollIntervalMs()), Path.of(o.getOutputRoot()), o.getWorkers(),
                o.getRingBufferSize(), o.getExpectedPafKeys());
    }

    private static Map<String, Object> props(ModelDefinition.ComponentDef c) {
        return c.getProperties() == null ? Map.of() : c.getProperties();
    }

    // ── Property helpers ──────────────────────────────────────────

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    static boolean getBoolean(Map<String, Object> props, String key, boolean def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
    }

    static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }

    /** Required data reference property. */
    static DataRef ref(Map<String, Object> props, String key) {
        DataRef r = DataRef.parse(props.get(key));
        if (r == null)
            throw new ConfigurationException("Missing property '" + key + "'");
        return r;
    }

    /**
     * Everything a draw needs, compiled and validated.
     */
    public record CompiledModel(SimulationSettings settings, RateResolver rates, List<CauseGraph> causes,
            RiskCatalog catalog, ExposureSampler sampler, RiskEffectEngine engine,
            List<DiseaseStateMachine> machines, Stratification stratification, PafMethod pafMethod,
            OrchestrationSettings orchestration) {

        /** New simulation over the compiled machines; {@code executor} may be null to run inline. */
        public Simulation newSimulation(ExecutorService executor) {
            return new Simulation(settings, machines, sampler, rates, executor);
        }

        public PafAggregator newAggregator(Simulation simulation) {
            return new PafAggregator(simulation, engine, stratification, pafMethod);
        }
    }
}
