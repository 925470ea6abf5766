package ai.asr.trn.read;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Numbers the lines of a reader and hands them out one at a time or in chunks.
 */
final class LineSource implements Closeable {

    private static final int INITIAL_CHUNK_CAPACITY = 1024;

    private final String name;
    private final BufferedReader reader;
    private long lineNumber;
    private boolean exhausted;

    LineSource(String name, BufferedReader reader) {
        this.name = Objects.requireNonNull(name, "name");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    String name() {
        return name;
    }

    NumberedLine next() {
        if (exhausted) {
            return null;
        }
        try {
            String text = reader.readLine();
            if (text == null) {
                exhausted = true;
                return null;
            }
            lineNumber++;
            return new NumberedLine(lineNumber, text);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read trn source " + name, ex);
        }
    }

    List<NumberedLine> nextChunk(int size) {
        List<NumberedLine> chunk = new ArrayList<>(Math.min(size, INITIAL_CHUNK_CAPACITY));
        while (chunk.size() < size) {
            NumberedLine line = next();
            if (line == null) {
                break;
            }
            chunk.add(line);
        }
        return chunk;
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to close trn source " + name, ex);
        }
    }
}
