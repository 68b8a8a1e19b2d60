package com.simsci.cvd.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of a model definition file. Keys are snake_case in
 * JSON; see {@link ModelLoader}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelDefinition {
    private SimulationDef simulation = new SimulationDef();
    private StratificationDef stratification;
    private Map<String, CauseDef> causes = new LinkedHashMap<>();
    private Map<String, RiskDef> risks = new LinkedHashMap<>();
    private List<CorrelationDef> correlations = new ArrayList<>();
    private List<EffectDef> effects = new ArrayList<>();
    /** Target ({@code cause.transition.rate_name}) to the table key of its joint PAF. */
    private Map<String, String> pafTables = new LinkedHashMap<>();
    private Map<String, List<TableRowDef>> tables = new LinkedHashMap<>();
    private OrchestrationDef orchestration = new OrchestrationDef();

    /** Time, population and numerics. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SimulationDef {
        private int populationSize = 100_000;
        private double ageStart = 7, ageEnd = 125;
        private double startYear = 2021;
        private double stepDays = 28;
        private int steps = 1;
        private double rateUnitDays = 365.25;
        private long seed;
        private int interpolationOrder;
        private boolean extrapolate = true;
        private int threads = 1;
        private int chunkSize = 4096;
        private String pafMethod;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StratificationDef {
        private List<AgeGroupDef> ageGroups;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AgeGroupDef {
        private String name;
        private double start, end;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CauseDef {
        private String initialState;
        private Map<String, StateDef> states = new LinkedHashMap<>();
        private Map<String, TransitionDef> transitions = new LinkedHashMap<>();
    }

    /** A state; data fields accept a table key, a number or a duration such as "28 days". */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StateDef {
        private String causeType;
        private boolean isTransient;
        private Boolean allowSelfTransition;
        private Object dwellTime, disabilityWeight, excessMortalityRate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TransitionDef {
        private String source, sink, dataType;
        /** Logical rate name ({@code incidence_rate}, ...) to a table key or literal. */
        private Map<String, Object> dataSources = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RiskDef {
        private String kind;
        private ComponentDef exposure;
        private Double floor, ceiling;
        private double tmrel;
        private String correlationGroup;
        private List<String> categories;
        private String referenceCategory;
    }

    /** A registry-built component: a type key plus free-form properties. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ComponentDef {
        private String type;
        private Map<String, Object> properties = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CorrelationDef {
        private String group;
        private List<String> risks;
        private List<AgeBandDef> ageBands;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AgeBandDef {
        private double ageStart, ageEnd;
        private double[][] matrix;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EffectDef {
        private String risk;
        private String target;
        private ComponentDef relativeRisk;
        private String mediator;
        private double mediatorWeight;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TableRowDef {
        private String sex;
        private double ageStart, ageEnd, yearStart, yearEnd, value;
    }

    /** Batch settings: which draws of which locations make up the artifact. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class OrchestrationDef {
        private String version = "v1";
        private int drawCount = 1000;
        private List<String> locations = new ArrayList<>();
        private int cpus = 1;
        private int memoryGb = 3;
        private int wallClockMinutes = 20;
        private long pollIntervalMs = 1000;
        private String outputRoot = "output";
        private int workers = 1;
        private int ringBufferSize = 1024;
        private int expectedPafKeys;
    }
}
