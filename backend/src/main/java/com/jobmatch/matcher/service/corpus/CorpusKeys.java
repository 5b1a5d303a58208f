package com.jobmatch.matcher.service.corpus;

/** Where summarized corpora live in the object store. */
public final class CorpusKeys {

  private CorpusKeys() {}

  public static String staged(String platform, String region) {
    return "temp/summarize/" + platform + "/" + region + ".csv";
  }

  public static String finalized(String platform, String region) {
    return "summarize/" + platform + "/" + region + ".csv";
  }
}
