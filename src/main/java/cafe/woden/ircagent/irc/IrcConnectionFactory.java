package cafe.woden.ircagent.irc;

import cafe.woden.ircagent.config.IrcAgentProperties;
import org.springframework.stereotype.Component;

@Component
public class IrcConnectionFactory {

  private final IrcAgentProperties.Client client;
  private final IrcTransportFactory transportFactory;
  private final ConnectionTimers timers;

  public IrcConnectionFactory(IrcAgentProperties props, IrcTransportFactory transportFactory, ConnectionTimers timers) {
    this.client = props.client();
    this.transportFactory = transportFactory;
    this.timers = timers;
  }

  public IrcConnection create(IrcAgentProperties.Account account) {
    return new IrcConnection(account, client, transportFactory.create(account.id()), timers);
  }
}
