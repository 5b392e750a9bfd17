package tech.automator.platform.principal;

import java.time.LocalDate;

/**
 * Personal details (embedded in User).
 */
public class UserProfile {

    public String firstName;
    public String lastName;
    public String displayName;
    public String avatarUrl;
    public String phone;
    public LocalDate dateOfBirth;
    public String gender;
    public String bio;

    public UserProfile() {
    }
}
