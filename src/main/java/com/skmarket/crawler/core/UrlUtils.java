package com.skmarket.crawler.core;

import java.net.URI;
import java.net.URISyntaxException;

public class UrlUtils {

  private UrlUtils() {
  }

  /**
   * Resolves {@code path} against {@code baseUrl}. A base without a trailing slash is treated as a directory,
   * so {@code https://www.sk-ah.com} + {@code history} gives {@code https://www.sk-ah.com/history}.
   */
  public static URI toAbsolute(String baseUrl, String path) {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("Base URL is required");
    }
    String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    try {
      URI baseUri = new URI(base);
      if (path == null || path.isBlank()) {
        return baseUri;
      }
      return baseUri.resolve(urlEncode(path));
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URL: " + baseUrl + " + " + path, e);
    }
  }

  public static String urlEncode(String s) {
    return s.replace(" ", "%20")
        .replace("[", "%5B")
        .replace("]", "%5D");
  }
}
