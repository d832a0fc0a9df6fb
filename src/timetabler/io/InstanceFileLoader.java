package timetabler.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetabler.model.Enrollment;
import timetabler.model.ProblemDescription;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads instance files of the form
 *
 * <pre>
 * Number of students: 3
 * Number of exams: 2
 * Number of slots: 4
 * Number of rooms: 1
 * Room 0 capacity: 5
 * 0 0
 * 1 2
 * </pre>
 *
 * The four counts and the room capacities come first and in this order; every
 * following non-blank line is an {@code <exam> <student>} pair.
 */
public class InstanceFileLoader {

    private static final Logger log = LoggerFactory.getLogger(InstanceFileLoader.class);

    private static final Pattern PAIR = Pattern.compile("^\\s*(\\d+)\\s+(\\d+)\\s*$");

    public static ProblemDescription load(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProblemDescription instance = read(br);
            log.info("Loaded {} from {}", instance, path);
            return instance;
        }
    }

    public static ProblemDescription parse(String text) throws IOException {
        return read(new StringReader(text));
    }

    public static ProblemDescription read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        int[] lineNo = {0};

        int students = readAttribute(br, lineNo, "Number of students");
        int exams = readAttribute(br, lineNo, "Number of exams");
        int slots = readAttribute(br, lineNo, "Number of slots");
        int rooms = readAttribute(br, lineNo, "Number of rooms");

        List<Integer> capacities = new ArrayList<>();
        for (int r = 0; r < rooms; r++) {
            capacities.add(readAttribute(br, lineNo, "Room " + r + " capacity"));
        }

        List<Enrollment> pairs = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            lineNo[0]++;
            String t = stripBom(line).trim();
            if (t.isEmpty()) continue;

            Matcher m = PAIR.matcher(t);
            if (!m.matches()) {
                throw new InstanceFormatException(lineNo[0], "Failed to parse this line: '" + t + "'");
            }
            pairs.add(new Enrollment(parseInt(m.group(1), lineNo[0]), parseInt(m.group(2), lineNo[0])));
        }

        return new ProblemDescription(students, exams, slots, rooms, capacities, pairs);
    }

    private static int readAttribute(BufferedReader br, int[] lineNo, String name) throws IOException {
        String line = br.readLine();
        lineNo[0]++;
        if (line == null) {
            throw new InstanceFormatException(lineNo[0], "Unexpected end of file while reading '" + name + "'");
        }
        String t = stripBom(line).trim();
        Matcher m = Pattern.compile(Pattern.quote(name) + ":\\s*(\\d+)$").matcher(t);
        if (!m.matches()) {
            throw new InstanceFormatException(lineNo[0],
                    "Could not parse line '" + t + "'; expected the '" + name + "' attribute");
        }
        return parseInt(m.group(1), lineNo[0]);
    }

    private static int parseInt(String digits, int lineNo) throws InstanceFormatException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InstanceFormatException(lineNo, "Number too large: " + digits);
        }
    }

    private static String stripBom(String s) {
        if (s == null) return null;
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
