package com.gentoro.claimgraph.derivative;

import java.util.List;

/** One raw, unvalidated set of derivative claims. */
@FunctionalInterface
public interface DerivativeSource {
  List<String> generate(String worldview, double temperature);
}
