package in.lockvault.domain.role;

import java.util.Set;

/**
 * Read model of everything the role engine knows about one account.
 *
 * @param timedRole null if the account never qualified for the temporary role
 */
public record AccountRoles(
    String account,
    Set<Role> permanentRoles,
    TimedRole timedRole
) {
    public boolean hasRole(Role role) {
        if (role.isPermanent()) {
            return permanentRoles.contains(role);
        }
        return timedRole != null && timedRole.active();
    }
}
