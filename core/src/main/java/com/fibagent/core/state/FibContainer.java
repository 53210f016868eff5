package com.fibagent.core.state;

import com.fibagent.core.model.AddressFamily;
import com.fibagent.core.model.RouterId;
import lombok.Value;
import lombok.With;

import java.util.function.UnaryOperator;

/**
 * The IPv4 and IPv6 FIBs of one router.
 */
@Value
@With
public class FibContainer {
    RouterId routerId;
    Fib fibV4;
    Fib fibV6;

    public static FibContainer empty(RouterId routerId) {
        return new FibContainer(routerId, Fib.empty(AddressFamily.V4), Fib.empty(AddressFamily.V6));
    }

    public Fib getFib(AddressFamily family) {
        return family == AddressFamily.V4 ? fibV4 : fibV6;
    }

    public FibContainer modifyFib(AddressFamily family, UnaryOperator<Fib> modifier) {
        Fib current = getFib(family);
        Fib modified = modifier.apply(current);
        if (modified == current) {
            return this;
        }
        if (modified.getFamily() != family) {
            throw new IllegalArgumentException("Expected a " + family + " FIB, got " + modified.getFamily());
        }
        return family == AddressFamily.V4 ? withFibV4(modified) : withFibV6(modified);
    }

    public int size() {
        return fibV4.size() + fibV6.size();
    }
}
