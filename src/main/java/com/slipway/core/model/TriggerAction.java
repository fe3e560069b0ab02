package com.slipway.core.model;

/**
 * Asks the run's deployment target to converge on the newest artifact.
 *
 * @param usernameSecret credential name holding the deployment API username
 * @param passwordSecret credential name holding the deployment API password
 */
public record TriggerAction(String usernameSecret, String passwordSecret) implements StageAction {

    @Override
    public Kind kind() {
        return Kind.TRIGGER;
    }
}
