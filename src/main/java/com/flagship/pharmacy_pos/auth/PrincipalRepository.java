package com.flagship.pharmacy_pos.auth;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface PrincipalRepository {

    Optional<Principal> findById(UUID id);

    /**
     * Active principals holding one of the roles, in a stable order.
     */
    List<Principal> findActiveByRoles(Set<Role> roles);

    /**
     * @return rows updated (0 when the user does not exist)
     */
    int updateSecurityState(UUID id, PrincipalSecurityUpdate update);
}
