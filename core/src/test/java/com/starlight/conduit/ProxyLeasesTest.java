package com.starlight.conduit;

import com.starlight.conduit.TestServices.Counter;
import com.starlight.conduit.TestServices.CounterImpl;
import com.starlight.conduit.driver.Endpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;


/**
 * Release of remote objects once their proxies have been garbage collected.
 */
@Timeout( value = 1, unit = TimeUnit.MINUTES )
public class ProxyLeasesTest {
	private static final Endpoint ENDPOINT = Endpoint.inproc( "lease-test" );


	private StubConduitDriver driver;
	private ServerSession server;
	private ClientSession client;


	@BeforeEach
	public void setUp() throws Exception {
		driver = new StubConduitDriver();
		server = ServerSession.newBuilder()
			.driver( driver )
			.endpoint( ENDPOINT )
			.functions( TestServices.newFunctionRegistry() )
			.workerThreads( 2 )
			.bind();
		client = ClientSession.newBuilder()
			.driver( driver )
			.endpoint( ENDPOINT )
			.functions( TestServices.newFunctionRegistry() )
			.defaultTimeout( 30, TimeUnit.SECONDS )
			.connect();
	}

	@AfterEach
	public void tearDown() {
		if ( client != null ) client.close();
		if ( server != null ) server.close();
		if ( driver != null ) driver.shutdown();
	}


	@Test
	public void testCollectedProxyReleasesObject() throws Exception {
		int id = createAndDrop();

		collectUntil( () -> !server.getObjectRegistry().contains( id ) );
		assertFalse( client.getLeases().isLeased( id ) );
	}


	@Test
	public void testObjectLivesWhileAnyProxyDoes() throws Exception {
		Counter counter = client.create( Counter.class );
		int id = Conduit.getObjectID( counter );

		// A second proxy for the same object, from a reply
		Counter self = counter.self();
		assertNotSame( counter, self );
		counter = null;

		for( int i = 0; i < 5; i++ ) {
			collect();
		}
		assertTrue( server.getObjectRegistry().contains( id ) );
		assertEquals( 1, self.add( 1 ) );

		self = null;
		collectUntil( () -> !server.getObjectRegistry().contains( id ) );
	}


	@Test
	public void testExportedObjectNotReleased() throws Exception {
		CounterImpl impl = new CounterImpl( 0 );
		int id = server.export( impl );

		useAndDrop( id );

		for( int i = 0; i < 5; i++ ) {
			collect();
		}
		assertTrue( server.getObjectRegistry().contains( id ) );
		assertFalse( impl.isClosed() );
		assertEquals( 2, impl.get() );
	}


	@Test
	public void testExplicitDestroyNotRepeated() throws Exception {
		Counter counter = client.create( Counter.class );
		int id = Conduit.getObjectID( counter );

		assertTrue( Conduit.destroy( counter ) );
		assertFalse( client.getLeases().isLeased( id ) );
		counter = null;

		int delivered = driver.getRequestsDelivered();
		for( int i = 0; i < 5; i++ ) {
			collect();
		}
		assertEquals( delivered, driver.getRequestsDelivered() );
	}


	@Test
	public void testNoReleaseAfterClose() throws Exception {
		int id = createAndDrop();
		client.close();

		int delivered = driver.getRequestsDelivered();
		for( int i = 0; i < 3; i++ ) {
			System.gc();
			Thread.sleep( 20 );
			assertEquals( 0, client.getLeases().reap() );
		}
		assertEquals( delivered, driver.getRequestsDelivered() );
		assertFalse( client.getLeases().isLeased( id ) );
	}


	@Test
	public void testLinkLossForgetsObjects() throws Exception {
		Counter counter = client.create( Counter.class );
		int id = Conduit.getObjectID( counter );
		assertTrue( client.getLeases().isLeased( id ) );

		driver.severLinks( ENDPOINT );
		collectUntil( () -> !client.getLeases().isLeased( id ) );

		// The server dropped it along with the peer
		assertFalse( server.getObjectRegistry().contains( id ) );
		assertFalse( client.isConnected() );
		assertEquals( id, Conduit.getObjectID( counter ) );
	}


	private int createAndDrop() {
		Counter counter = client.create( Counter.class );
		counter.add( 1 );
		return Conduit.getObjectID( counter );
	}


	private void useAndDrop( int id ) {
		Counter counter = client.proxyFor( Counter.class, id );
		counter.add( 1 );

		// Unowned, so the returned proxy doesn't release it either
		counter.self().add( 1 );
	}


	private void collect() throws InterruptedException {
		System.gc();
		Thread.sleep( 20 );
		client.getLeases().reap();
	}


	private void collectUntil( BooleanSupplier condition ) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 10000;
		while( !condition.getAsBoolean() ) {
			if ( System.currentTimeMillis() > deadline ) fail( "Condition not met" );
			collect();
		}
	}
}
