package com.acme.fabric;

import io.micronaut.runtime.Micronaut;

public class FabricApplication {
  public static void main(String[] args) {
    Micronaut.run(FabricApplication.class, args);
  }
}
