package dao.tron.msig.gateway;

import java.util.List;

/**
 * One permission of a native multi-key account: the key addresses allowed to sign under
 * it and the weight (here: signature count) required.
 */
public record AccountPermission(int permissionId, String name, int threshold, List<String> keys) {}
