package timetabler.io;

import java.io.IOException;

public class InstanceFormatException extends IOException {
    private final int lineNumber;

    public InstanceFormatException(int lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
