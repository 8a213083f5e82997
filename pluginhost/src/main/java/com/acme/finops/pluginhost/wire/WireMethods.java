package com.acme.finops.pluginhost.wire;

/**
 * RPC method names of the cost-source contract.
 */
public final class WireMethods {
    public static final String IDENTITY = "Identity";
    public static final String GET_PROJECTED_COST = "GetProjectedCost";
    public static final String GET_ACTUAL_COST = "GetActualCost";
    public static final String GET_RECOMMENDATIONS = "GetRecommendations";
    public static final String GET_PLUGIN_INFO = "GetPluginInfo";
    public static final String DRY_RUN = "DryRun";

    private WireMethods() {
    }
}
