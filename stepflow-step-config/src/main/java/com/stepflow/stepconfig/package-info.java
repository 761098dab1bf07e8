/**
 * Step configuration model: partial and finalized configurations, configuration updates and the
 * merge rules between them, settings key validation and JSON rendering.
 */
package com.stepflow.stepconfig;
