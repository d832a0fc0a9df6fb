package timetabler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetabler.assign.SeatAllocator;
import timetabler.config.ConfigLoader;
import timetabler.config.SchedulingConfig;
import timetabler.core.AnnealingScheduler;
import timetabler.core.SlotCalendar;
import timetabler.dao.DBManager;
import timetabler.export.ResultReporter;
import timetabler.export.ScheduleExporter;
import timetabler.io.InstanceFileLoader;
import timetabler.model.ProblemDescription;
import timetabler.model.ScheduleResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar exam-timetabler.jar instance.txt [--config file] [--seed n] [--iterations n]
 *      [--slots] [--csv out] [--xlsx out] [--pdf out] [--seats out] [--db file]
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("error: " + e.getMessage());
            out.println(Options.USAGE);
            return EXIT_USAGE;
        }

        try {
            SchedulingConfig config = opts.configFile == null
                    ? SchedulingConfig.defaults()
                    : ConfigLoader.load(opts.configFile);
            SchedulingConfig.Builder b = config.toBuilder();
            if (opts.seed != null) b.randomSeed(opts.seed);
            if (opts.iterations != null) b.maxIterations(opts.iterations);
            config = b.build();

            ProblemDescription problem = InstanceFileLoader.load(opts.instanceFile);
            ScheduleResult result = new AnnealingScheduler(config).solve(problem);

            ResultReporter reporter = new ResultReporter(
                    new SlotCalendar(problem.getNumberOfSlots(), config.getSlotsPerDay()));
            out.print(reporter.report(result));
            if (!result.isFeasible()) {
                out.print(reporter.diagnostics(result));
            } else if (opts.slotView) {
                out.print(reporter.slotView(result.getAssignment()));
            }

            if (result.getAssignment() != null) {
                List<String[]> rows = reporter.rows(problem, result.getAssignment());
                if (opts.csv != null) ScheduleExporter.exportCsv(rows, opts.csv);
                if (opts.xlsx != null) ScheduleExporter.exportExcel(rows, opts.xlsx);
                if (opts.pdf != null) ScheduleExporter.exportPdf(rows, opts.pdf);
            }
            if (opts.seats != null) {
                if (result.isFeasible()) {
                    SeatAllocator seating = new SeatAllocator(config.getRandomSeed());
                    ScheduleExporter.exportCsv(reporter.seatRows(seating.allocate(problem, result.getAssignment())),
                            opts.seats);
                } else {
                    log.warn("No feasible timetable, seating not written to {}", opts.seats);
                }
            }

            if (opts.db != null) {
                DBManager db = DBManager.forFile(opts.db);
                db.initializeDatabase();
                db.saveRun(result);
            }
            return EXIT_OK;
        } catch (IOException | SQLException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            out.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            // bad configuration or an instance that breaks the input contract
            log.error("Invalid input: {}", e.getMessage());
            out.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static final class Options {
        static final String USAGE = "usage: timetabler <instance-file> [--config file] [--seed n] [--iterations n]"
                + " [--slots] [--csv out] [--xlsx out] [--pdf out] [--seats out] [--db file]";

        Path instanceFile;
        Path configFile;
        Long seed;
        Integer iterations;
        boolean slotView;
        Path csv;
        Path xlsx;
        Path pdf;
        Path seats;
        Path db;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--config": o.configFile = Path.of(value(args, ++i, a)); break;
                    case "--seed": o.seed = parseLong(value(args, ++i, a), a); break;
                    case "--iterations": o.iterations = parseInt(value(args, ++i, a), a); break;
                    case "--slots": o.slotView = true; break;
                    case "--csv": o.csv = Path.of(value(args, ++i, a)); break;
                    case "--xlsx": o.xlsx = Path.of(value(args, ++i, a)); break;
                    case "--pdf": o.pdf = Path.of(value(args, ++i, a)); break;
                    case "--seats": o.seats = Path.of(value(args, ++i, a)); break;
                    case "--db": o.db = Path.of(value(args, ++i, a)); break;
                    default:
                        if (a.startsWith("--")) throw new IllegalArgumentException("unknown option " + a);
                        if (o.instanceFile != null) throw new IllegalArgumentException("more than one instance file");
                        o.instanceFile = Path.of(a);
                }
            }
            if (o.instanceFile == null) throw new IllegalArgumentException("missing instance file");
            return o;
        }

        private static String value(String[] args, int i, String option) {
            if (i >= args.length) throw new IllegalArgumentException(option + " needs a value");
            return args[i];
        }

        private static int parseInt(String v, String option) {
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number: " + v, e);
            }
        }

        private static long parseLong(String v, String option) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number: " + v, e);
            }
        }
    }
}
