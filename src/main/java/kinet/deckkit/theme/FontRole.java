package kinet.deckkit.theme;

import kinet.deckkit.ConfigurationException;

import java.util.Locale;

/**
 * Text roles that carry a default font size in a {@link Theme}.
 */
public enum FontRole {
    TITLE("title"),
    SUBTITLE("subtitle"),
    BULLET("bullet"),
    CODE("code"),
    BOX_TITLE("box-title"),
    BOX_DESCRIPTION("box-description");

    private final String key;

    FontRole(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FontRole fromKey(String key) {
        String k = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (FontRole role : values()) {
            if (role.key.equals(k)) return role;
        }
        throw new ConfigurationException("Unknown font role: '" + key + "'");
    }
}
