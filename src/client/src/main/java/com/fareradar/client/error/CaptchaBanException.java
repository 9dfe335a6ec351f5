package com.fareradar.client.error;

/** The backend flagged the traffic as automated and answered with a captcha redirect. */
public class CaptchaBanException extends SearchException {
  private final String banUrl;

  public CaptchaBanException(String banUrl) {
    super("Banned with captcha, solve it at " + banUrl);
    this.banUrl = banUrl;
  }

  public String banUrl() {
    return banUrl;
  }
}
