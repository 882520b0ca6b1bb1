package cafe.woden.ircagent.inbound;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A normalized inbound message that passed every gate.
 *
 * @param senderId nickname of the sender, as received
 * @param chatId the channel (lower-cased) for groups, the sender for direct messages
 * @param text the text forwarded to the agent; emotes are narrated as {@code * nick action}
 * @param addressed whether the message mentioned the bot's nickname
 * @param replyTarget where replies go: the channel, or the sender for direct messages
 */
@ValueObject
public record InboundMessage(
    String accountId,
    String senderId,
    ChatType chatType,
    String chatId,
    String text,
    boolean addressed,
    String replyTarget
) {
  public boolean isGroup() {
    return chatType == ChatType.GROUP;
  }
}
