package com.starlight.conduit.driver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;


public class EndpointTest {
	@Test
	public void testTcp() {
		Endpoint endpoint = Endpoint.parse( "TCP://127.0.0.1:5555" );
		assertEquals( Endpoint.TCP, endpoint.getScheme() );
		assertEquals( "127.0.0.1", endpoint.getHost() );
		assertEquals( 5555, endpoint.getPort() );
		assertFalse( endpoint.isWildcardHost() );
		assertEquals( "tcp://127.0.0.1:5555", endpoint.toString() );

		assertEquals( endpoint, Endpoint.tcp( "127.0.0.1", 5555 ) );
		assertEquals( endpoint.hashCode(), Endpoint.tcp( "127.0.0.1", 5555 ).hashCode() );
	}


	@Test
	public void testWildcardAndEphemeral() {
		Endpoint endpoint = Endpoint.parse( "tcp://*:0" );
		assertTrue( endpoint.isWildcardHost() );
		assertEquals( 0, endpoint.getPort() );
	}


	@Test
	public void testIPv6() {
		Endpoint endpoint = Endpoint.parse( "tcp://[::1]:8080" );
		assertEquals( "::1", endpoint.getHost() );
		assertEquals( 8080, endpoint.getPort() );
	}


	@Test
	public void testInproc() {
		Endpoint endpoint = Endpoint.inproc( "counter-service" );
		assertEquals( Endpoint.INPROC, endpoint.getScheme() );
		assertEquals( "counter-service", endpoint.getLocation() );

		try {
			endpoint.getPort();
			fail( "Shouldn't have worked" );
		}
		catch( IllegalStateException ex ) {
			// expected
		}
	}


	@Test
	public void testInvalid() {
		for( String invalid : new String[] { "", "tcp", "tcp://", "://host:1",
			"tcp://host", "tcp://host:abc", "tcp://host:70000", "tcp://:5555" } ) {

			try {
				Endpoint.parse( invalid );
				fail( "Shouldn't have parsed: " + invalid );
			}
			catch( IllegalArgumentException ex ) {
				// expected
			}
		}
	}


	@Test
	public void testRoutingIdentity() {
		byte[] bytes = { 0, 0, 0, 0, 7 };
		RoutingIdentity identity = new RoutingIdentity( bytes );

		// Defensive copies both ways
		bytes[ 4 ] = 8;
		assertArrayEquals( new byte[] { 0, 0, 0, 0, 7 }, identity.toBytes() );
		identity.toBytes()[ 4 ] = 9;
		assertArrayEquals( new byte[] { 0, 0, 0, 0, 7 }, identity.toBytes() );

		assertEquals( identity, new RoutingIdentity( new byte[] { 0, 0, 0, 0, 7 } ) );
		assertNotEquals( identity, new RoutingIdentity( new byte[] { 0, 0, 0, 0, 8 } ) );
		assertEquals( "Peer(0000000007)", identity.toString() );
	}


	@Test
	public void testSocketTypes() {
		assertTrue( SocketType.ROUTER.isBinding() );
		assertTrue( SocketType.REPLY.isBinding() );
		assertFalse( SocketType.DEALER.isBinding() );
		assertFalse( SocketType.REQUEST.isBinding() );

		assertTrue( SocketType.REQUEST.isAlternating() );
		assertTrue( SocketType.REPLY.isAlternating() );
		assertFalse( SocketType.DEALER.isAlternating() );
		assertFalse( SocketType.ROUTER.isAlternating() );
	}
}
