package org.dxworks.sieveframe.sieve.ast;

/**
 * Test expression of an {@code if}/{@code elsif}. The set of implementations is closed:
 * {@link AllOfTest}, {@link AnyOfTest}, {@link NotTest}, {@link HeaderTest}, {@link AddressTest},
 * {@link EnvelopeTest}, {@link SizeTest}, {@link ExistsTest}, {@link BodyTest} and
 * {@link BooleanTest}.
 */
public interface TestExpr {
}
