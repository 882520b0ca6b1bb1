package cafe.woden.ircagent;

import cafe.woden.ircagent.config.IrcAgentProperties;
import cafe.woden.ircagent.gateway.IrcAccountGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "IRCafe Agent Bridge",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(IrcAgentProperties.class)
public class IrcAgentApp {
  private static final Logger log = LoggerFactory.getLogger(IrcAgentApp.class);

  public static void main(String[] args) {
    SpringApplication.run(IrcAgentApp.class, args);
  }

  @Bean
  public ApplicationRunner startAccounts(IrcAccountGateway gateway, IrcAgentProperties props) {
    return args -> {
      if (props.accounts().isEmpty()) {
        log.warn("[ircagent] no irc.accounts configured; nothing to start");
        return;
      }
      gateway.startAllEnabled();
    };
  }
}
