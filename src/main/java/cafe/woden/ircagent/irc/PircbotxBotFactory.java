package cafe.woden.ircagent.irc;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import org.pircbotx.Configuration;
import org.pircbotx.PircBotX;
import org.pircbotx.cap.SASLCapHandler;
import org.pircbotx.hooks.ListenerAdapter;
import org.pircbotx.hooks.managers.ThreadedListenerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Factory for building a configured {@link PircBotX} instance for one account.
 *
 * <p>Keeps {@link PircbotxIrcTransport} focused on session handling and isolates the PircBotX
 * configuration details. The library's own reconnect, NickServ and auto-join support is never
 * enabled; {@link IrcConnection} owns all three.
 */
@Component
public class PircbotxBotFactory {
  private static final Logger log = LoggerFactory.getLogger(PircbotxBotFactory.class);

  static final String VERSION = "IRCafe Agent Bridge";

  public PircBotX build(TransportOptions o, ListenerAdapter listener, ExecutorService listenerExecutor) {
    return new PircBotX(buildConfiguration(o, listener, listenerExecutor));
  }

  Configuration buildConfiguration(TransportOptions o, ListenerAdapter listener, ExecutorService listenerExecutor) {
    SocketFactory socketFactory = o.tls()
        ? SSLSocketFactory.getDefault()
        : SocketFactory.getDefault();

    Configuration.Builder builder = new Configuration.Builder()
        .setName(o.nickname())
        .setLogin(o.username())
        .setRealName(o.realname())
        .setVersion(VERSION)
        .addServer(o.host(), o.port())
        .setSocketFactory(socketFactory)
        .setCapEnabled(true)
        .setAutoNickChange(true)
        // We manage reconnects ourselves so we can apply backoff and a hard ceiling.
        .setAutoReconnect(false)
        // One dispatch thread per bot keeps events in wire order.
        .setListenerManager(new ThreadedListenerManager(listenerExecutor))
        .addListener(listener);

    // PircBotX 2.x changed this API from setMessageDelay(long) to setMessageDelay(Delay).
    // To keep us compatible across minor versions, we set this via reflection.
    if (o.messageDelayMs() > 0) {
      applyMessageDelay(builder, o.messageDelayMs());
    }

    // SASL (PLAIN)
    if (o.hasSasl()) {
      if (o.saslUsername().isBlank() || o.saslPassword().isBlank()) {
        throw new IllegalStateException("SASL configured but username/password not set");
      }
      builder.addCapHandler(new SASLCapHandler(o.saslUsername(), o.saslPassword()));
    }

    return builder.buildConfiguration();
  }

  /**
   * Best-effort apply of PircBotX output throttle.
   *
   * <p>Older PircBotX versions have setMessageDelay(long). Newer versions use setMessageDelay(Delay).
   */
  static void applyMessageDelay(Configuration.Builder builder, long delayMs) {
    try {
      Method m = builder.getClass().getMethod("setMessageDelay", long.class);
      m.invoke(builder, delayMs);
      return;
    } catch (ReflectiveOperationException e) {
      log.debug("[ircagent] setMessageDelay(long) unavailable, trying Delay overload", e);
    }

    try {
      Class<?> delayType = Class.forName("org.pircbotx.delay.Delay");
      Method m = builder.getClass().getMethod("setMessageDelay", delayType);

      Object delayObj;
      if (delayType.isInterface()) {
        delayObj = java.lang.reflect.Proxy.newProxyInstance(
            delayType.getClassLoader(),
            new Class<?>[] { delayType },
            constantDelayHandler(delayMs)
        );
      } else {
        delayObj = Class.forName("org.pircbotx.delay.StaticDelay")
            .getConstructor(long.class)
            .newInstance(delayMs);
      }
      m.invoke(builder, delayObj);
    } catch (ReflectiveOperationException e) {
      log.warn("[ircagent] could not apply message delay of {}ms; keeping PircBotX default", delayMs, e);
    }
  }

  private static InvocationHandler constantDelayHandler(long delayMs) {
    return (proxy, method, args) -> {
      if (method.getDeclaringClass() == Object.class) {
        return switch (method.getName()) {
          case "toString" -> "ConstantDelay(" + delayMs + "ms)";
          case "hashCode" -> System.identityHashCode(proxy);
          case "equals" -> proxy == (args != null && args.length > 0 ? args[0] : null);
          default -> null;
        };
      }

      Class<?> rt = method.getReturnType();
      if (rt == long.class || rt == Long.class) return delayMs;
      if (rt == int.class || rt == Integer.class) return (int) Math.min(Integer.MAX_VALUE, delayMs);
      if (rt == Duration.class) return Duration.ofMillis(delayMs);
      return null;
    };
  }
}
