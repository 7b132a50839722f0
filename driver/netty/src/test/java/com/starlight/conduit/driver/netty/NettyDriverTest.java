// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Conduit nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit.driver.netty;

import com.starlight.conduit.Envelope;
import com.starlight.conduit.driver.DriverSocket;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.EnvelopeHandler;
import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.driver.SocketType;
import com.starlight.conduit.exception.NotConnectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;


/**
 * Socket-level behavior of the driver, without sessions on top.
 */
@Timeout( value = 1, unit = TimeUnit.MINUTES )
public class NettyDriverTest {
	private NettyConduitDriver driver;


	@BeforeEach
	public void setUp() {
		driver = NettyConduitDriver.newBuilder()
			.reconnectRetryInterval( 100, TimeUnit.MILLISECONDS )
			.build();
	}

	@AfterEach
	public void tearDown() {
		if ( driver != null ) driver.shutdown();
	}


	@Test
	public void testRouterDealerOverTCP() throws Exception {
		EnvelopeHandler router_handler = mock( EnvelopeHandler.class );
		DriverSocket router = driver.bind( Endpoint.parse( "tcp://127.0.0.1:0" ),
			SocketType.ROUTER, router_handler );

		int port = ( ( InetSocketAddress ) router.getLocalAddress() ).getPort();
		assertTrue( port > 0 );

		checkRouterDealer( router, router_handler, Endpoint.tcp( "127.0.0.1", port ) );
	}


	@Test
	public void testRouterDealerInProcess() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "driver-test" );

		EnvelopeHandler router_handler = mock( EnvelopeHandler.class );
		DriverSocket router = driver.bind( endpoint, SocketType.ROUTER, router_handler );

		checkRouterDealer( router, router_handler, endpoint );
	}


	private void checkRouterDealer( DriverSocket router, EnvelopeHandler router_handler,
		Endpoint endpoint ) throws Exception {

		EnvelopeHandler dealer_handler = mock( EnvelopeHandler.class );
		DriverSocket dealer = driver.connect( endpoint, SocketType.DEALER, dealer_handler );
		assertTrue( dealer.isConnected() );

		ArgumentCaptor<RoutingIdentity> identity_captor =
			ArgumentCaptor.forClass( RoutingIdentity.class );
		verify( router_handler, timeout( 2000 ) ).peerConnected( identity_captor.capture() );
		verify( dealer_handler, timeout( 2000 ) ).peerConnected( isNull() );
		assertTrue( router.isConnected() );

		RoutingIdentity identity = identity_captor.getValue();
		assertEquals( 5, identity.toBytes().length );
		assertEquals( 0, identity.toBytes()[ 0 ] );

		// Inbound: the identity is prepended
		dealer.send( Envelope.of( bytes( "hello" ), new byte[ 0 ], bytes( "world" ) ) );

		ArgumentCaptor<Envelope> envelope_captor = ArgumentCaptor.forClass( Envelope.class );
		verify( router_handler, timeout( 2000 ) ).envelopeReceived(
			envelope_captor.capture() );
		Envelope received = envelope_captor.getValue();
		assertEquals( 4, received.size() );
		assertArrayEquals( identity.toBytes(), received.get( 0 ) );
		assertArrayEquals( bytes( "hello" ), received.get( 1 ) );
		assertEquals( 0, received.get( 2 ).length );
		assertArrayEquals( bytes( "world" ), received.get( 3 ) );

		// Outbound: routed by the first part, which is removed
		router.send( Envelope.of( identity.toBytes(), bytes( "reply" ) ) );

		verify( dealer_handler, timeout( 2000 ) ).envelopeReceived(
			envelope_captor.capture() );
		received = envelope_captor.getValue();
		assertEquals( 1, received.size() );
		assertArrayEquals( bytes( "reply" ), received.get( 0 ) );

		// Unknown identities are dropped
		router.send( Envelope.of( new byte[] { 0, 0, 0, 0, 99 }, bytes( "lost" ) ) );

		dealer.close();
		verify( router_handler, timeout( 2000 ) ).peerDisconnected( identity );
		verify( dealer_handler, after( 200 ).never() ).peerDisconnected( any() );
		verify( dealer_handler, times( 1 ) ).envelopeReceived( any() );
	}


	@Test
	public void testDistinctIdentities() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "identities" );

		EnvelopeHandler router_handler = mock( EnvelopeHandler.class );
		DriverSocket router = driver.bind( endpoint, SocketType.ROUTER, router_handler );

		EnvelopeHandler first_handler = mock( EnvelopeHandler.class );
		EnvelopeHandler second_handler = mock( EnvelopeHandler.class );
		DriverSocket first = driver.connect( endpoint, SocketType.DEALER, first_handler );
		DriverSocket second = driver.connect( endpoint, SocketType.DEALER, second_handler );

		first.send( Envelope.of( bytes( "first" ) ) );
		second.send( Envelope.of( bytes( "second" ) ) );

		ArgumentCaptor<Envelope> captor = ArgumentCaptor.forClass( Envelope.class );
		verify( router_handler, timeout( 2000 ).times( 2 ) ).envelopeReceived(
			captor.capture() );
		List<Envelope> received = captor.getAllValues();

		RoutingIdentity first_identity = null;
		RoutingIdentity second_identity = null;
		for( Envelope envelope : received ) {
			RoutingIdentity identity = new RoutingIdentity( envelope.get( 0 ) );
			if ( new String( envelope.get( 1 ), StandardCharsets.UTF_8 ).equals( "first" ) ) {
				first_identity = identity;
			}
			else second_identity = identity;
		}
		assertNotNull( first_identity );
		assertNotNull( second_identity );
		assertNotEquals( first_identity, second_identity );

		// Each reply only goes to its own peer
		router.send( Envelope.of( second_identity.toBytes(), bytes( "to second" ) ) );
		verify( second_handler, timeout( 2000 ) ).envelopeReceived( captor.capture() );
		assertArrayEquals( bytes( "to second" ), captor.getValue().get( 0 ) );
		verify( first_handler, after( 200 ).never() ).envelopeReceived( any() );
	}


	@Test
	public void testRequestAlternation() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "alternation" );

		EnvelopeHandler reply_handler = mock( EnvelopeHandler.class );
		DriverSocket reply = driver.bind( endpoint, SocketType.REPLY, reply_handler );

		EnvelopeHandler request_handler = mock( EnvelopeHandler.class );
		DriverSocket request = driver.connect( endpoint, SocketType.REQUEST,
			request_handler );

		// Nothing to answer yet
		assertThrows( IllegalStateException.class,
			() -> reply.send( Envelope.of( bytes( "early" ) ) ) );

		request.send( Envelope.of( bytes( "one" ) ) );
		try {
			request.send( Envelope.of( bytes( "two" ) ) );
			fail( "Shouldn't have worked" );
		}
		catch( IllegalStateException ex ) {
			// expected
		}

		verify( reply_handler, timeout( 2000 ) ).envelopeReceived( any() );
		reply.send( Envelope.of( bytes( "answer" ) ) );
		verify( request_handler, timeout( 2000 ) ).envelopeReceived( any() );

		// Allowed again now that the reply arrived
		request.send( Envelope.of( bytes( "two" ) ) );
		verify( reply_handler, timeout( 2000 ).times( 2 ) ).envelopeReceived( any() );
	}


	@Test
	public void testFirstRequestOnFreshLink() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "fresh-link" );

		DriverSocket[] reply = new DriverSocket[ 1 ];
		reply[ 0 ] = driver.bind( endpoint, SocketType.REPLY, envelope -> {
			try {
				reply[ 0 ].send( Envelope.of( envelope.get( 0 ) ) );
			}
			catch( IOException ex ) {
				throw new RuntimeException( ex );
			}
		} );

		// Send the moment connect returns, racing the link activation
		for( int i = 0; i < 50; i++ ) {
			EnvelopeHandler handler = mock( EnvelopeHandler.class );
			DriverSocket request = driver.connect( endpoint, SocketType.REQUEST, handler );
			try {
				request.send( Envelope.of( bytes( "first " + i ) ) );

				ArgumentCaptor<Envelope> captor = ArgumentCaptor.forClass( Envelope.class );
				verify( handler, timeout( 2000 ) ).envelopeReceived( captor.capture() );
				assertArrayEquals( bytes( "first " + i ), captor.getValue().get( 0 ) );

				// Alternation still holds after the link came up
				request.send( Envelope.of( bytes( "second " + i ) ) );
				verify( handler, timeout( 2000 ).times( 2 ) ).envelopeReceived( any() );
			}
			finally {
				request.close();
			}
		}
	}


	@Test
	public void testReplySequencing() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "sequencing" );

		EnvelopeHandler reply_handler = mock( EnvelopeHandler.class );
		DriverSocket reply = driver.bind( endpoint, SocketType.REPLY, reply_handler );

		EnvelopeHandler a_handler = mock( EnvelopeHandler.class );
		EnvelopeHandler b_handler = mock( EnvelopeHandler.class );
		DriverSocket a = driver.connect( endpoint, SocketType.REQUEST, a_handler );
		DriverSocket b = driver.connect( endpoint, SocketType.REQUEST, b_handler );

		a.send( Envelope.of( bytes( "a" ) ) );
		b.send( Envelope.of( bytes( "b" ) ) );

		// Only one request is handed over until it's answered
		ArgumentCaptor<Envelope> captor = ArgumentCaptor.forClass( Envelope.class );
		verify( reply_handler, timeout( 2000 ) ).envelopeReceived( captor.capture() );
		verify( reply_handler, after( 300 ).times( 1 ) ).envelopeReceived( any() );

		String first = new String( captor.getValue().get( 0 ), StandardCharsets.UTF_8 );
		reply.send( Envelope.of( bytes( "reply to " + first ) ) );

		verify( reply_handler, timeout( 2000 ).times( 2 ) ).envelopeReceived(
			captor.capture() );
		String second = new String( captor.getValue().get( 0 ), StandardCharsets.UTF_8 );
		assertNotEquals( first, second );
		reply.send( Envelope.of( bytes( "reply to " + second ) ) );

		verify( a_handler, timeout( 2000 ) ).envelopeReceived( captor.capture() );
		assertArrayEquals( bytes( "reply to a" ), captor.getValue().get( 0 ) );
		verify( b_handler, timeout( 2000 ) ).envelopeReceived( captor.capture() );
		assertArrayEquals( bytes( "reply to b" ), captor.getValue().get( 0 ) );
	}


	@Test
	public void testReconnect() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "reconnect" );

		EnvelopeHandler router_handler = mock( EnvelopeHandler.class );
		DriverSocket router = driver.bind( endpoint, SocketType.ROUTER, router_handler );

		EnvelopeHandler dealer_handler = mock( EnvelopeHandler.class );
		DriverSocket dealer = driver.connect( endpoint, SocketType.DEALER, dealer_handler );
		verify( dealer_handler, timeout( 2000 ) ).peerConnected( isNull() );

		router.close();
		verify( dealer_handler, timeout( 2000 ) ).peerDisconnected( isNull() );
		assertFalse( dealer.isConnected() );

		try {
			dealer.send( Envelope.of( bytes( "nobody home" ) ) );
			fail( "Shouldn't have worked" );
		}
		catch( NotConnectedException ex ) {
			// expected
		}

		EnvelopeHandler new_handler = mock( EnvelopeHandler.class );
		driver.bind( endpoint, SocketType.ROUTER, new_handler );

		verify( dealer_handler, timeout( 5000 ).times( 2 ) ).peerConnected( isNull() );
		verify( new_handler, timeout( 2000 ) ).peerConnected( any() );
		assertTrue( dealer.isConnected() );

		dealer.send( Envelope.of( bytes( "back" ) ) );
		verify( new_handler, timeout( 2000 ) ).envelopeReceived( any() );
	}


	@Test
	public void testHeartbeatsKeepIdleLinks() throws Exception {
		driver.shutdown();
		driver = NettyConduitDriver.newBuilder()
			.heartbeatInterval( 100, TimeUnit.MILLISECONDS )
			.livenessTimeout( 400, TimeUnit.MILLISECONDS )
			.build();

		Endpoint endpoint = Endpoint.inproc( "heartbeat" );
		EnvelopeHandler router_handler = mock( EnvelopeHandler.class );
		driver.bind( endpoint, SocketType.ROUTER, router_handler );

		EnvelopeHandler dealer_handler = mock( EnvelopeHandler.class );
		DriverSocket dealer = driver.connect( endpoint, SocketType.DEALER, dealer_handler );

		// Idle for several liveness periods; heartbeats aren't delivered as envelopes
		verify( dealer_handler, after( 1500 ).never() ).peerDisconnected( any() );
		verify( router_handler, never() ).envelopeReceived( any() );
		verify( dealer_handler, never() ).envelopeReceived( any() );
		assertTrue( dealer.isConnected() );
	}


	@Test
	public void testSocketTypeChecks() {
		EnvelopeHandler handler = mock( EnvelopeHandler.class );
		Endpoint endpoint = Endpoint.inproc( "type-checks" );

		assertThrows( IllegalArgumentException.class,
			() -> driver.bind( endpoint, SocketType.DEALER, handler ) );
		assertThrows( IllegalArgumentException.class,
			() -> driver.bind( endpoint, SocketType.REQUEST, handler ) );
		assertThrows( IllegalArgumentException.class,
			() -> driver.connect( endpoint, SocketType.ROUTER, handler ) );
		assertThrows( IllegalArgumentException.class,
			() -> driver.connect( endpoint, SocketType.REPLY, handler ) );

		// Only tcp and inproc are served
		assertThrows( IllegalArgumentException.class, () -> driver.bind(
			Endpoint.parse( "ipc:///tmp/conduit" ), SocketType.ROUTER, handler ) );
	}


	@Test
	public void testConnectFailure() {
		EnvelopeHandler handler = mock( EnvelopeHandler.class );

		IOException ex = assertThrows( IOException.class, () -> driver.connect(
			Endpoint.inproc( "nothing-bound-here" ), SocketType.DEALER, handler ) );
		assertTrue( ex instanceof ConnectException || ex.getCause() != null, ex.toString() );
	}


	@Test
	public void testShutdown() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "shutdown" );
		EnvelopeHandler handler = mock( EnvelopeHandler.class );
		DriverSocket router = driver.bind( endpoint, SocketType.ROUTER, handler );

		driver.shutdown();

		assertThrows( IOException.class,
			() -> router.send( Envelope.of( new byte[ 5 ], bytes( "x" ) ) ) );
		assertThrows( IOException.class,
			() -> driver.bind( endpoint, SocketType.ROUTER, handler ) );

		// Idempotent
		driver.shutdown();
	}


	private static byte[] bytes( String string ) {
		return string.getBytes( StandardCharsets.UTF_8 );
	}
}
