package com.slipway.core.model;

import java.io.Serializable;

/**
 * What a stage does once its environment is up. Exactly one variant per stage.
 */
public sealed interface StageAction extends Serializable
        permits BuildAction, PublishAction, TriggerAction {

    enum Kind { BUILD, PUBLISH, TRIGGER }

    Kind kind();
}
