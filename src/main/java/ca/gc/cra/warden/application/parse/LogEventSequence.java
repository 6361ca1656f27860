package ca.gc.cra.warden.application.parse;

import ca.gc.cra.warden.domain.events.LogEvent;
import ca.gc.cra.warden.domain.log.RawLogFile;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Restartable view of the events in one stream. Each {@link #iterator()} starts a fresh pass over the
 * text, so repeated iteration yields the identical sequence.
 */
public final class LogEventSequence implements Iterable<LogEvent> {
  private final RawLogFile file;
  private final LogParser parser;

  LogEventSequence(RawLogFile file, LogParser parser) {
    this.file = file;
    this.parser = parser;
  }

  /**
   * Returns the stream this sequence reads.
   *
   * @return source stream
   */
  public RawLogFile source() {
    return file;
  }

  @Override
  public Iterator<LogEvent> iterator() {
    return new EventIterator(new BufferedReader(new StringReader(file.text())));
  }

  /**
   * Drains one pass into a list.
   *
   * @return all events in line order
   */
  public List<LogEvent> toList() {
    List<LogEvent> events = new ArrayList<>();
    for (LogEvent event : this) {
      events.add(event);
    }
    return List.copyOf(events);
  }

  private final class EventIterator implements Iterator<LogEvent> {
    private final BufferedReader reader;
    private final Deque<LogEvent> pending = new ArrayDeque<>();
    private int lineNumber;
    private boolean exhausted;

    private EventIterator(BufferedReader reader) {
      this.reader = reader;
    }

    @Override
    public boolean hasNext() {
      while (pending.isEmpty() && !exhausted) {
        String line = readLine();
        if (line == null) {
          exhausted = true;
          break;
        }
        lineNumber++;
        pending.addAll(parser.parseLine(line, lineNumber, file.streamKind()));
      }
      return !pending.isEmpty();
    }

    @Override
    public LogEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return pending.removeFirst();
    }

    private String readLine() {
      try {
        return reader.readLine();
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed reading in-memory log text", ex);
      }
    }
  }
}
