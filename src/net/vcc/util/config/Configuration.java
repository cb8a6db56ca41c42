package net.vcc.util.config;

/**
 * A source of string-valued settings.
 * Keys are dotted names like "vcc.tabSize"; absent settings are null.
 */
public interface Configuration {

    String get(String key);

}
