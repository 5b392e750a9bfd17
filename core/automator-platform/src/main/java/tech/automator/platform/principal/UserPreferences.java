package tech.automator.platform.principal;

/**
 * UI and notification preferences (embedded in User).
 * Fields stay null when used as a patch; {@link #defaults()} seeds new accounts.
 */
public class UserPreferences {

    public String language;
    public String timezone;
    public String theme;
    public Boolean notificationsEnabled;

    public UserPreferences() {
    }

    public static UserPreferences defaults() {
        UserPreferences preferences = new UserPreferences();
        preferences.language = "en";
        preferences.timezone = "UTC";
        preferences.theme = "light";
        preferences.notificationsEnabled = true;
        return preferences;
    }
}
