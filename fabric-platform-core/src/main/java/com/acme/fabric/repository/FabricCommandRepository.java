package com.acme.fabric.repository;

import com.acme.fabric.domain.DuplicateFabricCodeException;
import com.acme.fabric.domain.Fabric;
import com.acme.fabric.domain.FabricNotFoundException;

/**
 * Current-state persistence for fabrics. Writes run inside the caller's transaction when one is
 * active.
 */
public interface FabricCommandRepository {

  /**
   * Persists a newly created fabric. The existing row for the code, if any, is read under a row
   * lock first. An ACTIVE row is rejected; a DELETED row is reactivated in place and the
   * reactivated aggregate, carrying its pending {@code FabricReactivated} event, is returned in
   * place of the argument.
   *
   * @throws DuplicateFabricCodeException if an ACTIVE fabric already uses the code
   */
  Fabric save(Fabric fabric);

  /** @throws FabricNotFoundException if there is no ACTIVE fabric with the code */
  Fabric getActive(String code);

  /** @throws FabricNotFoundException if no row exists for the code */
  Fabric getIncludingDeleted(String code);

  /**
   * Writes the aggregate's attributes and new version, conditioned on the row still being ACTIVE
   * at {@code version - 1}.
   *
   * @throws FabricNotFoundException if no row matched
   */
  void update(Fabric fabric);

  /**
   * Marks the row DELETED at the aggregate's new version, conditioned on the row still being ACTIVE
   * at {@code version - 1}.
   *
   * @throws FabricNotFoundException if no row matched
   */
  void delete(Fabric fabric);
}
