package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.config.ExecutorConfig;
import io.reactivex.rxjava3.core.Scheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Default {@link IrcTransportFactory}: one PircBotX-backed transport per account. */
@Component
public class PircbotxTransportFactory implements IrcTransportFactory {

  private final PircbotxBotFactory botFactory;
  private final Scheduler ioScheduler;

  public PircbotxTransportFactory(
      PircbotxBotFactory botFactory,
      @Qualifier(ExecutorConfig.IO_SCHEDULER) Scheduler ioScheduler) {
    this.botFactory = botFactory;
    this.ioScheduler = ioScheduler;
  }

  @Override
  public IrcTransport create(String accountId) {
    return new PircbotxIrcTransport(accountId, botFactory, ioScheduler);
  }
}
