package cafe.woden.ircagent.status;

import org.jmolecules.ddd.annotation.ValueObject;

@ValueObject
public record StatusIssue(String accountId, String kind, String message) {

  public static final String KIND_RUNTIME = "runtime";
}
