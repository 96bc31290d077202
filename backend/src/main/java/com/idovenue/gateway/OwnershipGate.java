package com.idovenue.gateway;

/**
 * Authorization check for privileged venue operations. Ownership transfer lives behind this
 * seam and is not handled by the venue itself.
 */
public interface OwnershipGate {

    void requireOwner(String caller);
}
