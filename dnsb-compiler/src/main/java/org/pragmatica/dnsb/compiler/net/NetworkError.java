package org.pragmatica.dnsb.compiler.net;

import org.pragmatica.lang.Cause;

/**
 * Address planning failures.
 */
public sealed interface NetworkError extends Cause {
    record InvalidSubnet(String subnet) implements NetworkError {
        @Override
        public String message() {
            return "Invalid IPv4 subnet '" + subnet + "'";
        }
    }

    record InvalidAddress(String service, String address) implements NetworkError {
        @Override
        public String message() {
            return "Service '" + service + "' has invalid static address '" + address + "'";
        }
    }

    record AddressOutsideSubnet(String service, String address, String subnet) implements NetworkError {
        @Override
        public String message() {
            return "Static address '" + address + "' of service '" + service + "' is not in subnet '" + subnet + "'";
        }
    }

    record AddressTaken(String service, String address, String owner) implements NetworkError {
        @Override
        public String message() {
            return "Static address '" + address + "' of service '" + service + "' is already allocated to '" + owner + "'";
        }
    }

    record SubnetExhausted(String subnet, String service) implements NetworkError {
        @Override
        public String message() {
            return "Subnet " + subnet + " has no free address left for service '" + service + "'";
        }
    }
}
