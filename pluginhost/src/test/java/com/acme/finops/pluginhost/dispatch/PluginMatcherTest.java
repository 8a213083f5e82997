package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginMatcherTest {

    private static PluginManifest manifest(List<String> providers, Map<String, String> metadata) {
        return new PluginManifest("p", "1.0.0", "1.0.0", providers, Path.of("/opt/p"), metadata, null);
    }

    @Test
    void shouldMatchOnProviderOrWildcard() {
        ResourceDescriptor s3 = new ResourceDescriptor("", "aws:s3/bucket:Bucket", PropertyBag.empty());
        assertTrue(PluginMatcher.matches(manifest(List.of("aws"), Map.of()), s3));
        assertTrue(PluginMatcher.matches(manifest(List.of("*"), Map.of()), s3));
        assertFalse(PluginMatcher.matches(manifest(List.of("azure"), Map.of()), s3));
    }

    @Test
    void shouldHonorResourceTypeGlobs() {
        PluginManifest ec2Only = manifest(List.of("aws"), Map.of(PluginMatcher.RESOURCE_TYPES_KEY, "aws:ec2/*, aws:rds/instance:Instance"));

        assertTrue(PluginMatcher.matches(ec2Only, new ResourceDescriptor("aws", "aws:ec2/instance:Instance", null)));
        assertTrue(PluginMatcher.matches(ec2Only, new ResourceDescriptor("aws", "AWS:RDS/instance:Instance", null)));
        assertFalse(PluginMatcher.matches(ec2Only, new ResourceDescriptor("aws", "aws:s3/bucket:Bucket", null)));
        assertTrue(PluginMatcher.globMatches("a*c*", "abcde"));
        assertFalse(PluginMatcher.globMatches("a.c", "abc"));
    }
}
