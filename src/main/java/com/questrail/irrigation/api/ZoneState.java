package com.questrail.irrigation.api;

/**
 * Physical/bookkeeping state of a sprinkler zone.
 */
public enum ZoneState
{
    OFF,
    ON
}
