package tech.automator.platform.shared;

import java.util.Objects;

/**
 * Postal address embedded in users and organizations.
 */
public class Address {

    public String street;
    public String city;
    public String state;
    public String postalCode;
    public String country;

    public Address() {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address other)) return false;
        return Objects.equals(street, other.street)
            && Objects.equals(city, other.city)
            && Objects.equals(state, other.state)
            && Objects.equals(postalCode, other.postalCode)
            && Objects.equals(country, other.country);
    }

    @Override
    public int hashCode() {
        return Objects.hash(street, city, state, postalCode, country);
    }
}
