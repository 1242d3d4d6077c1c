package com.gentoro.clm.encoder.transcript;

import java.util.List;

/** Everything the transcript encoder renders, gathered in one pass over the turns. */
public record TranscriptAnalysis(
    CallInfo call,
    CustomerProfile customer,
    ContactInfo contact,
    Issue issue,
    List<AgentAction> actions,
    Resolution resolution,
    List<String> sentiment) {

  public TranscriptAnalysis {
    actions = List.copyOf(actions);
    sentiment = List.copyOf(sentiment);
  }

  public record CallInfo(String type, String agent, int durationMinutes, String channel) {}

  public record CustomerProfile(String name, String account, String tier) {
    public boolean isEmpty() {
      return name == null && account == null && tier == null;
    }
  }

  public record ContactInfo(String email, String phone, String order, String tracking) {
    public boolean isEmpty() {
      return email == null && phone == null && order == null && tracking == null;
    }
  }

  /**
   * @param amounts money amounts mentioned by the customer, in order of appearance
   */
  public record Issue(
      String type, String severity, List<String> amounts, String frequency, String impact) {
    public Issue {
      amounts = List.copyOf(amounts);
    }
  }

  public record AgentAction(
      String type, String result, String reference, String timeline, String amount, String method) {}

  public record Resolution(String state, String timeline, String ticket) {}
}
