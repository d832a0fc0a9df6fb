package timetabler.config;

/**
 * Immutable tuning parameters of the scheduler: calendar shape, hard-rule
 * thresholds, penalty weights and the annealing schedule. Instances are
 * created through {@link #builder()} and handed to the scheduler; there is no
 * shared global copy.
 */
public final class SchedulingConfig {

    public static final int DEFAULT_SLOTS_PER_DAY = 4;
    public static final int DEFAULT_MIN_GAP = 1;
    public static final int DEFAULT_TURNAROUND_GAP = 1;
    public static final int DEFAULT_LARGE_EXAM_THRESHOLD = 10;
    public static final int DEFAULT_EXAMINER_CAPACITY = 10;
    public static final int DEFAULT_MAX_EXAMS_PER_DAY = 2;
    public static final int DEFAULT_LARGE_EXAM_DEMAND = 3;
    public static final int DEFAULT_SMALL_EXAM_DEMAND = 2;

    public static final int DEFAULT_W_ROOM_DOUBLE = 10;
    public static final int DEFAULT_W_CLASH = 10;
    public static final int DEFAULT_W_MIN_GAP = 6;
    public static final int DEFAULT_W_DAY_CAP = 8;
    public static final int DEFAULT_W_TURNAROUND = 6;
    public static final int DEFAULT_W_LAST_SLOT = 12;
    public static final int DEFAULT_W_INVIG = 8;

    public static final int DEFAULT_MAX_ITERATIONS = 20000;
    public static final double DEFAULT_T_START = 3.0;
    public static final double DEFAULT_T_END = 0.01;
    public static final double MIN_TEMPERATURE = 1e-6;
    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final int slotsPerDay;
    private final int minGap;
    private final int turnaroundGap;
    private final int largeExamThreshold;
    private final int examinerCapacity;
    private final int maxExamsPerDay;
    private final int largeExamDemand;
    private final int smallExamDemand;

    private final int roomDoubleWeight;
    private final int clashWeight;
    private final int minGapWeight;
    private final int dayCapWeight;
    private final int turnaroundWeight;
    private final int lastSlotWeight;
    private final int invigilatorWeight;

    private final int maxIterations;
    private final double startTemperature;
    private final double endTemperature;
    private final long randomSeed;

    private SchedulingConfig(Builder b) {
        this.slotsPerDay = b.slotsPerDay;
        this.minGap = b.minGap;
        this.turnaroundGap = b.turnaroundGap;
        this.largeExamThreshold = b.largeExamThreshold;
        this.examinerCapacity = b.examinerCapacity;
        this.maxExamsPerDay = b.maxExamsPerDay;
        this.largeExamDemand = b.largeExamDemand;
        this.smallExamDemand = b.smallExamDemand;
        this.roomDoubleWeight = b.roomDoubleWeight;
        this.clashWeight = b.clashWeight;
        this.minGapWeight = b.minGapWeight;
        this.dayCapWeight = b.dayCapWeight;
        this.turnaroundWeight = b.turnaroundWeight;
        this.lastSlotWeight = b.lastSlotWeight;
        this.invigilatorWeight = b.invigilatorWeight;
        this.maxIterations = b.maxIterations;
        this.startTemperature = b.startTemperature;
        this.endTemperature = b.endTemperature;
        this.randomSeed = b.randomSeed;
    }

    public static SchedulingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .slotsPerDay(slotsPerDay)
                .minGap(minGap)
                .turnaroundGap(turnaroundGap)
                .largeExamThreshold(largeExamThreshold)
                .examinerCapacity(examinerCapacity)
                .maxExamsPerDay(maxExamsPerDay)
                .largeExamDemand(largeExamDemand)
                .smallExamDemand(smallExamDemand)
                .roomDoubleWeight(roomDoubleWeight)
                .clashWeight(clashWeight)
                .minGapWeight(minGapWeight)
                .dayCapWeight(dayCapWeight)
                .turnaroundWeight(turnaroundWeight)
                .lastSlotWeight(lastSlotWeight)
                .invigilatorWeight(invigilatorWeight)
                .maxIterations(maxIterations)
                .startTemperature(startTemperature)
                .endTemperature(endTemperature)
                .randomSeed(randomSeed);
    }

    public int getSlotsPerDay() { return slotsPerDay; }
    public int getMinGap() { return minGap; }
    public int getTurnaroundGap() { return turnaroundGap; }
    public int getLargeExamThreshold() { return largeExamThreshold; }
    public int getExaminerCapacity() { return examinerCapacity; }
    public int getMaxExamsPerDay() { return maxExamsPerDay; }
    public int getLargeExamDemand() { return largeExamDemand; }
    public int getSmallExamDemand() { return smallExamDemand; }

    public int getRoomDoubleWeight() { return roomDoubleWeight; }
    public int getClashWeight() { return clashWeight; }
    public int getMinGapWeight() { return minGapWeight; }
    public int getDayCapWeight() { return dayCapWeight; }
    public int getTurnaroundWeight() { return turnaroundWeight; }
    public int getLastSlotWeight() { return lastSlotWeight; }
    public int getInvigilatorWeight() { return invigilatorWeight; }

    public int getMaxIterations() { return maxIterations; }
    public double getStartTemperature() { return startTemperature; }
    public double getEndTemperature() { return endTemperature; }
    public long getRandomSeed() { return randomSeed; }

    public boolean isLargeExam(int examSize) {
        return examSize >= largeExamThreshold;
    }

    public int invigilatorDemand(int examSize) {
        return isLargeExam(examSize) ? largeExamDemand : smallExamDemand;
    }

    @Override
    public String toString() {
        return "SchedulingConfig[slotsPerDay=" + slotsPerDay + ", minGap=" + minGap
                + ", turnaroundGap=" + turnaroundGap + ", largeExamThreshold=" + largeExamThreshold
                + ", examinerCapacity=" + examinerCapacity + ", maxIterations=" + maxIterations
                + ", tStart=" + startTemperature + ", tEnd=" + endTemperature + ", seed=" + randomSeed + "]";
    }

    public static final class Builder {
        private int slotsPerDay = DEFAULT_SLOTS_PER_DAY;
        private int minGap = DEFAULT_MIN_GAP;
        private int turnaroundGap = DEFAULT_TURNAROUND_GAP;
        private int largeExamThreshold = DEFAULT_LARGE_EXAM_THRESHOLD;
        private int examinerCapacity = DEFAULT_EXAMINER_CAPACITY;
        private int maxExamsPerDay = DEFAULT_MAX_EXAMS_PER_DAY;
        private int largeExamDemand = DEFAULT_LARGE_EXAM_DEMAND;
        private int smallExamDemand = DEFAULT_SMALL_EXAM_DEMAND;

        private int roomDoubleWeight = DEFAULT_W_ROOM_DOUBLE;
        private int clashWeight = DEFAULT_W_CLASH;
        private int minGapWeight = DEFAULT_W_MIN_GAP;
        private int dayCapWeight = DEFAULT_W_DAY_CAP;
        private int turnaroundWeight = DEFAULT_W_TURNAROUND;
        private int lastSlotWeight = DEFAULT_W_LAST_SLOT;
        private int invigilatorWeight = DEFAULT_W_INVIG;

        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double startTemperature = DEFAULT_T_START;
        private double endTemperature = DEFAULT_T_END;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        private Builder() {
        }

        public Builder slotsPerDay(int v) { this.slotsPerDay = v; return this; }
        public Builder minGap(int v) { this.minGap = v; return this; }
        public Builder turnaroundGap(int v) { this.turnaroundGap = v; return this; }
        public Builder largeExamThreshold(int v) { this.largeExamThreshold = v; return this; }
        public Builder examinerCapacity(int v) { this.examinerCapacity = v; return this; }
        public Builder maxExamsPerDay(int v) { this.maxExamsPerDay = v; return this; }
        public Builder largeExamDemand(int v) { this.largeExamDemand = v; return this; }
        public Builder smallExamDemand(int v) { this.smallExamDemand = v; return this; }

        public Builder roomDoubleWeight(int v) { this.roomDoubleWeight = v; return this; }
        public Builder clashWeight(int v) { this.clashWeight = v; return this; }
        public Builder minGapWeight(int v) { this.minGapWeight = v; return this; }
        public Builder dayCapWeight(int v) { this.dayCapWeight = v; return this; }
        public Builder turnaroundWeight(int v) { this.turnaroundWeight = v; return this; }
        public Builder lastSlotWeight(int v) { this.lastSlotWeight = v; return this; }
        public Builder invigilatorWeight(int v) { this.invigilatorWeight = v; return this; }

        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder startTemperature(double v) { this.startTemperature = v; return this; }
        public Builder endTemperature(double v) { this.endTemperature = v; return this; }
        public Builder randomSeed(long v) { this.randomSeed = v; return this; }

        public SchedulingConfig build() {
            requireNonNegative("minGap", minGap);
            requireNonNegative("turnaroundGap", turnaroundGap);
            requireNonNegative("largeExamThreshold", largeExamThreshold);
            requireNonNegative("examinerCapacity", examinerCapacity);
            requireNonNegative("maxExamsPerDay", maxExamsPerDay);
            requireNonNegative("largeExamDemand", largeExamDemand);
            requireNonNegative("smallExamDemand", smallExamDemand);
            requirePositive("weight.roomDouble", roomDoubleWeight);
            requirePositive("weight.clash", clashWeight);
            requirePositive("weight.minGap", minGapWeight);
            requirePositive("weight.dayCap", dayCapWeight);
            requirePositive("weight.turnaround", turnaroundWeight);
            requirePositive("weight.lastSlot", lastSlotWeight);
            requirePositive("weight.invigilator", invigilatorWeight);
            requireNonNegative("anneal.maxIterations", maxIterations);
            if (!(startTemperature > 0) || Double.isInfinite(startTemperature))
                throw new IllegalArgumentException("anneal.startTemperature must be a positive number: " + startTemperature);
            if (!(endTemperature > 0) || Double.isInfinite(endTemperature))
                throw new IllegalArgumentException("anneal.endTemperature must be a positive number: " + endTemperature);
            // slotsPerDay <= 0 is allowed: the whole horizon is then a single day
            return new SchedulingConfig(this);
        }

        // a zero weight would let a broken constraint add nothing to the cost
        private static void requirePositive(String key, int value) {
            if (value <= 0)
                throw new IllegalArgumentException(key + " must be positive: " + value);
        }

        private static void requireNonNegative(String key, int value) {
            if (value < 0)
                throw new IllegalArgumentException(key + " must be non-negative: " + value);
        }
    }
}
