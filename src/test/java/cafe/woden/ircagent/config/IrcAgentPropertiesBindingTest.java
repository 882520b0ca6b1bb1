package cafe.woden.ircagent.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class IrcAgentPropertiesBindingTest {

  @Configuration
  @EnableConfigurationProperties(IrcAgentProperties.class)
  static class PropsConfig {}

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    runner.run(ctx -> {
      IrcAgentProperties props = ctx.getBean(IrcAgentProperties.class);

      assertThat(props.accounts()).isEmpty();
      assertEquals(1_000, props.client().reconnect().initialDelayMs());
      assertEquals(10, props.client().reconnect().maxAttempts());
      assertEquals(5, props.client().rateLimit().maxRequests());
      assertEquals(450, props.client().outbound().maxChunkLength());
      assertEquals(500, props.client().outbound().chunkDelayMs());
      assertThat(props.agent().command()).containsExactly("openclaw", "agent");
      assertEquals(120_000, props.agent().timeoutMs());
    });
  }

  @Test
  void bindsAccountsWithNormalisedGroupsAndAllowLists() {
    runner.withPropertyValues(
            "irc.accounts[0].id=libera",
            "irc.accounts[0].server=irc.libera.chat",
            "irc.accounts[0].nickname=clawbot",
            "irc.accounts[0].sasl.username=clawbot",
            "irc.accounts[0].sasl.password=s3cret",
            "irc.accounts[0].channels[0]=#java",
            "irc.accounts[0].dm.policy=open",
            "irc.accounts[0].dm.allow-from[0]= Alice ",
            "irc.accounts[0].group-policy=denylist",
            "irc.accounts[0].groups[#Java].users[0]=Troll",
            "irc.client.reconnect.max-attempts=0")
        .run(ctx -> {
          IrcAgentProperties props = ctx.getBean(IrcAgentProperties.class);
          IrcAgentProperties.Account acct = props.accounts().get(0);

          assertEquals("libera", acct.id());
          assertEquals(6697, acct.port());
          assertTrue(acct.tls());
          assertTrue(acct.hasSasl());
          assertFalse(acct.toString().contains("s3cret"));
          assertThat(acct.dm().allowFrom()).containsExactly("alice");
          assertThat(acct.group("#JAVA").users()).containsExactly("troll");
          assertThat(acct.channels()).containsExactly("#java");
          assertEquals(10, props.client().reconnect().maxAttempts());
        });
  }

  @Test
  void invalidNicknameFailsStartup() {
    runner.withPropertyValues(
            "irc.accounts[0].id=libera",
            "irc.accounts[0].nickname=9lives")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void saslNeedsBothCredentials() {
    runner.withPropertyValues(
            "irc.accounts[0].id=libera",
            "irc.accounts[0].sasl.username=clawbot")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void unknownPoliciesAreKeptVerbatim() {
    IrcAgentProperties.Account acct = new IrcAgentProperties.Account(
        "x", null, "irc.example.net", null, null, null, null, null, null, null, false, null,
        new IrcAgentProperties.Account.Dm("Everyone", null), "Whitelist", null);

    assertEquals("Everyone", acct.dm().policy());
    assertEquals("Whitelist", acct.groupPolicy());
  }

  @Test
  void formatAllowFromTrimsDropsBlanksAndLowerCases() {
    assertThat(IrcAgentProperties.formatAllowFrom(List.of(" Bob ", "", "  ", "ALICE")))
        .containsExactly("bob", "alice");
    assertThat(IrcAgentProperties.formatAllowFrom(null)).isEmpty();
  }
}
