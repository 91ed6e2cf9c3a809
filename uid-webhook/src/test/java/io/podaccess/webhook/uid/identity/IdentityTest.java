/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.podaccess.webhook.uid.identity;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class IdentityTest {
    @Test
    public void testServiceAccount() {
        Identity identity = Identity.parse("system:serviceaccount:teamA:builder");

        assertThat(identity, instanceOf(Identity.ServiceAccount.class));
        Identity.ServiceAccount serviceAccount = (Identity.ServiceAccount) identity;
        assertThat(serviceAccount.namespace(), is("teamA"));
        assertThat(serviceAccount.name(), is("builder"));
        assertThat(serviceAccount.username(), is("system:serviceaccount:teamA:builder"));
    }

    @Test
    public void testServiceAccountWithEmptyName() {
        Identity identity = Identity.parse("system:serviceaccount:teamA:");

        assertThat(identity, is(new Identity.ServiceAccount("system:serviceaccount:teamA:", "teamA", "")));
    }

    @Test
    public void testMalformedServiceAccount() {
        assertThat(Identity.parse("system:serviceaccount:teamA"), is(new Identity.Unrecognized("system:serviceaccount:teamA")));
        assertThat(Identity.parse("system:serviceaccount:teamA:builder:extra"), is(new Identity.Unrecognized("system:serviceaccount:teamA:builder:extra")));
        assertThat(Identity.parse("system:serviceaccount:"), is(new Identity.Unrecognized("system:serviceaccount:")));
    }

    @Test
    public void testUser() {
        assertThat(Identity.parse("alice"), is(new Identity.User("alice")));
        assertThat(Identity.parse("oidc:alice@example.com"), is(new Identity.User("oidc:alice@example.com")));
        assertThat(Identity.parse("system:serviceaccounts:teamA:builder"), is(new Identity.User("system:serviceaccounts:teamA:builder")));
    }

    @Test
    public void testEmptyAndNullUser() {
        assertThat(Identity.parse(""), is(new Identity.User("")));
        assertThat(Identity.parse(null), is(new Identity.User("")));
    }
}
