package org.agentranker.engine.domain.model;

import org.agentranker.engine.domain.exception.ValidationException;

import java.util.Objects;

/**
 * Immutable customer profile that a ranking request is conditioned on.
 * Instances are always valid: both factories reject missing fields and blank names.
 */
public final class CustomerProfile {

    private final CommunicationMethod communicationMethod;
    private final LeadSource leadSource;
    private final Destination destination;
    private final LaunchLocation launchLocation;
    private final String customerName;

    private CustomerProfile(CommunicationMethod communicationMethod, LeadSource leadSource,
                            Destination destination, LaunchLocation launchLocation, String customerName) {
        this.communicationMethod = communicationMethod;
        this.leadSource = leadSource;
        this.destination = destination;
        this.launchLocation = launchLocation;
        this.customerName = customerName;
    }

    /**
     * Creates a profile from already-typed values.
     *
     * @throws ValidationException if any value is missing or the customer name is blank
     */
    public static CustomerProfile of(CommunicationMethod communicationMethod, LeadSource leadSource,
                                     Destination destination, LaunchLocation launchLocation, String customerName) {
        requirePresent(communicationMethod, "communication_method");
        requirePresent(leadSource, "lead_source");
        requirePresent(destination, "destination");
        requirePresent(launchLocation, "launch_location");
        if (customerName == null || customerName.trim().isEmpty()) {
            throw new ValidationException("customer_name", "customer_name must not be empty");
        }
        return new CustomerProfile(communicationMethod, leadSource, destination, launchLocation, customerName.trim());
    }

    /**
     * Creates a profile from raw labels as received from a caller.
     *
     * @throws ValidationException on the first field that is missing or outside its enumeration
     */
    public static CustomerProfile fromLabels(String communicationMethod, String leadSource,
                                             String destination, String launchLocation, String customerName) {
        return of(CommunicationMethod.fromLabel(communicationMethod),
                LeadSource.fromLabel(leadSource),
                Destination.fromLabel(destination),
                LaunchLocation.fromLabel(launchLocation),
                customerName);
    }

    private static void requirePresent(Object value, String field) {
        if (value == null) {
            throw new ValidationException(field, field + " must not be null");
        }
    }

    public CommunicationMethod getCommunicationMethod() {
        return communicationMethod;
    }

    public LeadSource getLeadSource() {
        return leadSource;
    }

    public Destination getDestination() {
        return destination;
    }

    public LaunchLocation getLaunchLocation() {
        return launchLocation;
    }

    public String getCustomerName() {
        return customerName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CustomerProfile)) {
            return false;
        }
        CustomerProfile that = (CustomerProfile) o;
        return communicationMethod == that.communicationMethod
                && leadSource == that.leadSource
                && destination == that.destination
                && launchLocation == that.launchLocation
                && customerName.equals(that.customerName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(communicationMethod, leadSource, destination, launchLocation, customerName);
    }

    @Override
    public String toString() {
        return String.format("CustomerProfile{name='%s', communication=%s, leadSource=%s, destination=%s, launch=%s}",
                customerName, communicationMethod.getLabel(), leadSource.getLabel(),
                destination.getLabel(), launchLocation.getLabel());
    }
}
