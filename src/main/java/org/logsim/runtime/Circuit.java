package org.logsim.runtime;

import org.logsim.names.NameTable;

/**
 * A built circuit: the registries produced from one definition, sharing one name table.
 *
 * @param names The name table used while building.
 * @param devices The device registry.
 * @param network The connectivity and evaluator.
 * @param monitors The monitor set.
 */
public record Circuit(NameTable names, Devices devices, Network network, Monitors monitors) {
}
