package outreach.spring.boot;

import org.springframework.context.SmartLifecycle;
import outreach.Outreach;

import java.util.Objects;

/**
 * Starts the engine's background loops with the application context and closes them on
 * shutdown. A closed engine is not restarted.
 */
public class OutreachLifecycle implements SmartLifecycle {

  private final Outreach outreach;
  private volatile boolean running;

  public OutreachLifecycle(Outreach outreach) {
    this.outreach = Objects.requireNonNull(outreach, "outreach");
  }

  @Override
  public void start() {
    outreach.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    outreach.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
