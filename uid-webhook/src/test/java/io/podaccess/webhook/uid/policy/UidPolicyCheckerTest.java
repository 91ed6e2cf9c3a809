/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.policy;

import io.fabric8.kubernetes.api.model.Pod;
import io.podaccess.webhook.common.Admission;
import io.podaccess.webhook.uid.validation.Validation;
import io.podaccess.webhook.uid.validation.ValidationFailure;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static io.podaccess.webhook.uid.ResourceUtils.UID_MAP_NAME;
import static io.podaccess.webhook.uid.ResourceUtils.WEBHOOK_NAMESPACE;
import static io.podaccess.webhook.uid.ResourceUtils.createAdmission;
import static io.podaccess.webhook.uid.ResourceUtils.createPod;
import static io.podaccess.webhook.uid.ResourceUtils.createPodWithoutSecurityContext;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class UidPolicyCheckerTest {
    private static final NamespaceProvider NAMESPACE_PROVIDER = () -> WEBHOOK_NAMESPACE;

    private static Validation check(UidMapProvider uidMapProvider, Pod pod, String subject) {
        Admission admission = createAdmission("system:serviceaccount:teamA:" + subject, pod);
        return new UidPolicyChecker(NAMESPACE_PROVIDER, uidMapProvider, UID_MAP_NAME).check(pod, subject, admission);
    }

    @Test
    public void testPodWithoutRunAsUserIsValid() throws UidMapException {
        UidMapProvider uidMapProvider = mock(UidMapProvider.class);

        Validation validation = check(uidMapProvider, createPod("builder", null), "builder");
        assertThat(validation.valid(), is(true));
        assertThat(validation.reason(), is("Valid uid"));
        assertThat(validation.failure(), is(ValidationFailure.NONE));

        validation = check(uidMapProvider, createPodWithoutSecurityContext("builder"), "builder");
        assertThat(validation.valid(), is(true));

        validation = check(uidMapProvider, new Pod(), "");
        assertThat(validation.valid(), is(true));

        verify(uidMapProvider, never()).getUidMap(any(), any());
    }

    @Test
    public void testMatchingUidIsValid() throws UidMapException {
        UidMapProvider uidMapProvider = mock(UidMapProvider.class);
        when(uidMapProvider.getUidMap(WEBHOOK_NAMESPACE, UID_MAP_NAME)).thenReturn(Map.of("builder", "1000"));

        Validation validation = check(uidMapProvider, createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(true));
        assertThat(validation.reason(), is("Valid uid"));
        verify(uidMapProvider).getUidMap(WEBHOOK_NAMESPACE, UID_MAP_NAME);
    }

    @Test
    public void testDifferentUidIsInvalid() {
        Validation validation = check((namespace, name) -> Map.of("builder", "1000"), createPod("builder", 2000L), "builder");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.UID_MISMATCH));
        assertThat(validation.reason(), is("Invalid uid, expected: 1000, found: 2000"));
    }

    @Test
    public void testComparisonOfExpectedAndFoundUids() {
        long[][] pairs = {{0, 0}, {1000, 1000}, {-1, -1}, {Long.MAX_VALUE, Long.MAX_VALUE}, {1000, 1001}, {0, 65534}, {Long.MIN_VALUE, Long.MAX_VALUE}};

        for (long[] pair : pairs) {
            long expected = pair[0];
            long found = pair[1];

            Validation validation = check((namespace, name) -> Map.of("builder", String.valueOf(expected)), createPod("builder", found), "builder");

            assertThat(validation.valid(), is(expected == found));
            if (expected != found) {
                assertThat(validation.reason(), containsString(String.valueOf(expected)));
                assertThat(validation.reason(), containsString(String.valueOf(found)));
            }
        }
    }

    @Test
    public void testSignedUidValueIsParsed() {
        Validation validation = check((namespace, name) -> Map.of("builder", "+1000"), createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(true));
    }

    @Test
    public void testMissingSubjectIsInvalid() {
        Validation validation = check((namespace, name) -> Map.of("builder", "1000"), createPod("builder", 500L), "alice");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.NO_UID_ASSOCIATED));
        assertThat(validation.reason(), containsString("alice has no UID associated"));
    }

    @Test
    public void testEmptySubjectIsInvalid() {
        Validation validation = check((namespace, name) -> Map.of("builder", "1000"), createPod("builder", 1000L), "");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.NO_UID_ASSOCIATED));
    }

    @Test
    public void testEmptyUidValueIsReportedAsMissing() {
        Validation validation = check((namespace, name) -> Map.of("builder", ""), createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.NO_UID_ASSOCIATED));
        assertThat(validation.reason(), containsString("no UID associated"));
    }

    @Test
    public void testMalformedUidValueIsInvalid() {
        for (String value : new String[] {"one-thousand", " 1000", "1000.0", "0x3e8", "99999999999999999999"}) {
            Validation validation = check((namespace, name) -> Map.of("builder", value), createPod("builder", 1000L), "builder");

            assertThat(validation.valid(), is(false));
            assertThat(validation.failure(), is(ValidationFailure.MALFORMED_UID));
            assertThat(validation.reason(), containsString("Failed to convert UID to int64"));
        }
    }

    @Test
    public void testNamespaceFailureIsInvalidEvenWithoutRunAsUser() throws UidMapException {
        UidMapProvider uidMapProvider = mock(UidMapProvider.class);
        NamespaceProvider failingNamespaceProvider = () -> {
            throw new IOException("/var/run/secrets/kubernetes.io/serviceaccount/namespace: No such file");
        };
        Pod pod = createPod("builder", null);

        Validation validation = new UidPolicyChecker(failingNamespaceProvider, uidMapProvider, UID_MAP_NAME)
                .check(pod, "builder", createAdmission("alice", pod));

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.NAMESPACE_UNAVAILABLE));
        assertThat(validation.reason(), containsString("No such file"));
        verify(uidMapProvider, never()).getUidMap(any(), any());
    }

    @Test
    public void testClientInitializationFailureIsInvalid() {
        UidMapProvider uidMapProvider = (namespace, name) -> {
            throw new UidMapException(UidMapException.Kind.CLIENT_INITIALIZATION, "no in-cluster configuration");
        };

        Validation validation = check(uidMapProvider, createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.CLIENT_INITIALIZATION));
        assertThat(validation.reason(), is("Failed initializing Kubernetes client: no in-cluster configuration"));
    }

    @Test
    public void testFetchFailureIsInvalid() {
        UidMapProvider uidMapProvider = (namespace, name) -> {
            throw new UidMapException(UidMapException.Kind.FETCH, "connection refused");
        };

        Validation validation = check(uidMapProvider, createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.UID_MAP_FETCH));
        assertThat(validation.reason(), is("Failed getting ConfigMap: connection refused"));
    }

    @Test
    public void testUnexpectedErrorIsInvalid() {
        UidMapProvider uidMapProvider = (namespace, name) -> {
            throw new IllegalStateException("boom");
        };

        Validation validation = check(uidMapProvider, createPod("builder", 1000L), "builder");

        assertThat(validation.valid(), is(false));
        assertThat(validation.failure(), is(ValidationFailure.INTERNAL_ERROR));
        assertThat(validation.reason(), containsString("boom"));
    }
}
