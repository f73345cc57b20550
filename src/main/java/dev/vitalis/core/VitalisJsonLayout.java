/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Console layout for {@code core.log.json}. Each event becomes one Gson-serialized object per line.
 *
 * <p>Vitalis messages follow {@code "(vitalis) key=value ..."}; the well-known keys ({@code code},
 * {@code op}, {@code world}, {@code player}, {@code module}) are lifted into top-level fields so
 * log shippers can filter on them without parsing the message.
 */
final class VitalisJsonLayout extends LayoutBase<ILoggingEvent> {
  static final Set<String> LIFTED_KEYS = Set.of("code", "op", "world", "player", "module");
  private static final String PREFIX = "(vitalis)";
  private static final Pattern PAIR = Pattern.compile("(?:^|\\s)([a-z]+)=(\\S+)");
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty("ts", Instant.ofEpochMilli(event.getTimeStamp()).toString());
    json.addProperty("level", event.getLevel().toString());
    json.addProperty("logger", event.getLoggerName());
    json.addProperty("thread", event.getThreadName());
    String message = event.getFormattedMessage();
    json.addProperty("message", message);
    liftPairs(message, json);

    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      JsonObject context = new JsonObject();
      mdc.forEach(context::addProperty);
      json.add("mdc", context);
    }
    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      json.addProperty("stack", ThrowableProxyUtil.asString(throwable));
    }
    return GSON.toJson(json) + System.lineSeparator();
  }

  static void liftPairs(String message, JsonObject json) {
    if (message == null || !message.startsWith(PREFIX)) {
      return;
    }
    // message= carries free text and always comes last
    int free = message.indexOf(" message=");
    String head = free < 0 ? message : message.substring(0, free);
    Matcher matcher = PAIR.matcher(head.substring(PREFIX.length()));
    while (matcher.find()) {
      String key = matcher.group(1);
      if (LIFTED_KEYS.contains(key) && !json.has(key)) {
        json.addProperty(key, matcher.group(2));
      }
    }
  }
}
