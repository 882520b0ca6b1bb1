package cafe.woden.ircagent.inbound;

public enum ChatType {
  DIRECT,
  GROUP
}
