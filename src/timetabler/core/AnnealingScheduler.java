package timetabler.core;

import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetabler.config.SchedulingConfig;
import timetabler.model.Assignment;
import timetabler.model.InfeasibilityReason;
import timetabler.model.InputContractViolationException;
import timetabler.model.Placement;
import timetabler.model.ProblemDescription;
import timetabler.model.ScheduleResult;
import timetabler.model.SearchPhase;

import java.util.List;
import java.util.function.LongFunction;

/**
 * Stochastic local search for exam timetables.
 * <p>
 * Starts from a random complete assignment drawn from the candidate sets and
 * repeatedly relocates one random exam to one of its random candidates. A
 * move that beats the best cost so far is kept and becomes the new best;
 * any other move is kept with probability
 * {@code exp(-(newCost - bestCost) / temperature)} and undone otherwise. The
 * comparison is against the best cost, not the cost before the move. The
 * temperature decays geometrically from {@code T_start} to {@code T_end} over
 * the iteration budget and the search stops as soon as the best cost is zero.
 */
public class AnnealingScheduler {

    private static final Logger log = LoggerFactory.getLogger(AnnealingScheduler.class);

    private final SchedulingConfig config;
    private final LongFunction<RandomSource> randomFactory;

    public AnnealingScheduler(SchedulingConfig config) {
        this(config, SeededRandomSource::new);
    }

    public AnnealingScheduler(SchedulingConfig config, LongFunction<RandomSource> randomFactory) {
        if (config == null) throw new IllegalArgumentException("config is null");
        if (randomFactory == null) throw new IllegalArgumentException("randomFactory is null");
        this.config = config;
        this.randomFactory = randomFactory;
    }

    public SchedulingConfig getConfig() {
        return config;
    }

    public ScheduleResult solve(ProblemDescription problem) {
        return solve(problem, randomFactory.apply(config.getRandomSeed()));
    }

    public ScheduleResult solve(ProblemDescription problem, RandomSource random) {
        validate(problem);
        log.info("Scheduler started: {}", problem);
        StopWatch stopWatch = StopWatch.createStarted();

        int exams = problem.getNumberOfExams();
        if (exams == 0) {
            log.info("No exams to place, trivially feasible");
            return ScheduleResult.feasible(new Assignment(0))
                    .phase(SearchPhase.TERMINATED_FEASIBLE)
                    .seed(config.getRandomSeed())
                    .runtimeMillis(elapsedMillis(stopWatch))
                    .build();
        }

        // 1. Derived data: incidence, calendar, candidates
        IncidenceIndex index = IncidenceIndex.build(problem);
        SlotCalendar calendar = new SlotCalendar(problem.getNumberOfSlots(), config.getSlotsPerDay());
        CandidateSet candidates = new CandidateGenerator(config).generate(problem, index, calendar);
        log.debug("Generated {} candidate placements for {} exams", candidates.totalSize(), exams);

        if (!candidates.isStructurallyFeasible()) {
            List<Integer> stuck = candidates.examsWithoutCandidates();
            log.warn("Structurally infeasible: exam(s) {} have no room/slot candidate", stuck);
            return ScheduleResult.infeasible(InfeasibilityReason.STRUCTURAL)
                    .examsWithoutCandidates(stuck)
                    .phase(SearchPhase.INIT)
                    .bestCost(-1)
                    .seed(config.getRandomSeed())
                    .runtimeMillis(elapsedMillis(stopWatch))
                    .build();
        }

        CostEvaluator evaluator = new CostEvaluator(problem, index, calendar, config);

        // 2. Init: one uniform candidate per exam, in exam order
        SearchState state = new SearchState(random, config.getMaxIterations());
        Assignment initial = new Assignment(exams);
        for (int e = 0; e < exams; e++) {
            initial.place(e, random.choose(candidates.get(e)));
        }
        state.start(initial, evaluator.cost(initial));
        log.debug("Initial cost {}", state.bestCost());

        // 3. Sampling
        anneal(state, candidates, evaluator);
        state.terminate();

        double runtime = elapsedMillis(stopWatch);
        ScheduleResult.Builder result;
        if (state.phase() == SearchPhase.TERMINATED_FEASIBLE) {
            log.info("Feasible timetable found after {} iteration(s) in {} ms", state.iteration(),
                    String.format("%.3f", runtime));
            result = ScheduleResult.feasible(state.best());
        } else {
            log.warn("Search exhausted after {} iteration(s), best cost {}", state.iteration(), state.bestCost());
            result = ScheduleResult.infeasible(InfeasibilityReason.SEARCH_EXHAUSTED)
                    .assignment(state.best())
                    .violations(evaluator.explain(state.best()));
        }
        return result
                .phase(state.phase())
                .bestCost(state.bestCost())
                .iterations(state.iteration())
                .acceptedMoves(state.accepted())
                .rejectedMoves(state.rejected())
                .skippedMoves(state.skipped())
                .bestCostTrace(state.bestCostTrace())
                .seed(config.getRandomSeed())
                .runtimeMillis(runtime)
                .build();
    }

    private void anneal(SearchState state, CandidateSet candidates, CostEvaluator evaluator) {
        int maxIterations = config.getMaxIterations();
        int exams = candidates.numberOfExams();
        RandomSource random = state.random();
        Assignment current = state.current();

        for (int it = 0; it < maxIterations; it++) {
            if (state.bestCost() == 0) {
                break;
            }
            double temp = temperatureAt(it, maxIterations, config.getStartTemperature(),
                    config.getEndTemperature());
            state.setTemperature(temp);

            // Propose: random exam, random candidate of that exam
            int e = random.nextInt(exams);
            Placement old = current.getPlacement(e);
            Placement proposed = random.choose(candidates.get(e));
            if (proposed.equals(old)) {
                state.skip();
                state.endIteration();
                continue;
            }

            current.place(e, proposed);
            int newCost = evaluator.cost(current);

            if (newCost < state.bestCost()) {
                state.acceptImprovement(newCost);
                log.debug("Iteration {}: best cost improved to {}", it, newCost);
            } else {
                double p = Math.exp(-(newCost - state.bestCost())
                        / Math.max(temp, SchedulingConfig.MIN_TEMPERATURE));
                if (random.nextDouble() < p) {
                    state.acceptWorse(newCost);
                } else {
                    current.place(e, old);
                    state.reject();
                }
            }
            state.endIteration();
        }
    }

    /**
     * Geometric cooling: {@code start * (end / start) ^ (iteration / maxIterations)}.
     */
    static double temperatureAt(int iteration, int maxIterations, double start, double end) {
        if (maxIterations <= 0) return start;
        return start * Math.pow(end / start, (double) iteration / maxIterations);
    }

    private static void validate(ProblemDescription problem) {
        if (problem == null) {
            throw new InputContractViolationException("problem description is null");
        }
        // ProblemDescription checks this already; the engine does not rely on it
        if (problem.getRoomCapacities().size() != problem.getNumberOfRooms()) {
            throw new InputContractViolationException("room_capacities length must equal number_of_rooms");
        }
    }

    private static double elapsedMillis(StopWatch stopWatch) {
        stopWatch.stop();
        return stopWatch.getNanoTime() / 1_000_000.0;
    }
}
