package com.starlight.conduit.driver.netty;

import com.starlight.conduit.ClientSession;
import com.starlight.conduit.Conduit;
import com.starlight.conduit.ConnectionListener;
import com.starlight.conduit.ExportedType;
import com.starlight.conduit.FunctionRegistry;
import com.starlight.conduit.ServerSession;
import com.starlight.conduit.driver.Endpoint;
import com.starlight.conduit.driver.SocketType;
import com.starlight.conduit.exception.SessionClosedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;


/**
 * Sessions running over the Netty driver.
 */
@Timeout( value = 1, unit = TimeUnit.MINUTES )
public class NettySessionTest {
	private static final ExportedType<Counter> COUNTER_TYPE =
		ExportedType.newBuilder( "counter", Counter.class )
			.constructor( args -> new CounterImpl() )
			.build();

	private static final ExportedType<Echo> ECHO_TYPE =
		ExportedType.newBuilder( "echo", Echo.class )
			.constructor( args -> new EchoImpl() )
			.build();


	private NettyConduitDriver driver;
	private ServerSession server;
	private final List<ClientSession> clients = new ArrayList<>();
	private ExecutorService executor;


	@BeforeEach
	public void setUp() {
		driver = NettyConduitDriver.newBuilder()
			.reconnectRetryInterval( 100, TimeUnit.MILLISECONDS )
			.build();
		executor = Executors.newCachedThreadPool();
	}

	@AfterEach
	public void tearDown() {
		clients.forEach( ClientSession::close );
		if ( server != null ) server.close();
		if ( driver != null ) driver.shutdown();
		if ( executor != null ) executor.shutdownNow();
	}


	@Test
	public void testTCP() throws Exception {
		server = bind( Endpoint.parse( "tcp://127.0.0.1:0" ), SocketType.ROUTER );
		int port = ( ( InetSocketAddress ) server.getLocalAddress() ).getPort();

		checkCounter( connect( Endpoint.tcp( "127.0.0.1", port ), SocketType.DEALER ) );
	}


	@Test
	public void testInProcess() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-session" );
		server = bind( endpoint, SocketType.ROUTER );

		checkCounter( connect( endpoint, SocketType.DEALER ) );
	}


	@Test
	public void testRequestReply() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-request-reply" );
		server = bind( endpoint, SocketType.REPLY );

		ClientSession client = connect( endpoint, SocketType.REQUEST );
		checkCounter( client );

		// Concurrent callers take turns on the socket
		Counter counter = client.create( Counter.class );
		List<Future<?>> futures = new ArrayList<>();
		for( int t = 0; t < 4; t++ ) {
			futures.add( executor.submit( () -> {
				for( int i = 0; i < 25; i++ ) {
					counter.add( 1 );
				}
				return null;
			} ) );
		}
		for( Future<?> future : futures ) {
			future.get( 30, TimeUnit.SECONDS );
		}
		assertEquals( 100, counter.get() );
	}


	@Test
	public void testFirstCallOnFreshRequestSession() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-fresh-request" );
		server = bind( endpoint, SocketType.REPLY );

		// The first call goes out as soon as connect returns
		for( int i = 0; i < 25; i++ ) {
			try( ClientSession client = ClientSession.newBuilder()
				.driver( driver )
				.endpoint( endpoint )
				.socketType( SocketType.REQUEST )
				.functions( functions() )
				.defaultTimeout( 5, TimeUnit.SECONDS )
				.connect() ) {

				Counter counter = client.create( Counter.class );
				assertEquals( i, counter.add( i ) );
			}
		}
	}


	@Test
	public void testNestedCalls() throws Exception {
		Endpoint backend_endpoint = Endpoint.inproc( "netty-backend" );
		ServerSession backend = bind( backend_endpoint, SocketType.ROUTER );
		try {
			ClientSession backend_client = connect( backend_endpoint, SocketType.DEALER );

			// Each relay creates and calls a counter on the backend
			FunctionRegistry functions = functions();
			functions.register( ExportedType.newBuilder( "relay", Relay.class )
				.constructor( args -> new RelayImpl( backend_client.create( Counter.class ) ) )
				.build() );

			Endpoint endpoint = Endpoint.inproc( "netty-frontend" );
			server = bind( endpoint, SocketType.ROUTER, functions );
			ClientSession client = connect( endpoint, SocketType.DEALER, functions );

			Relay relay = client.create( Relay.class );
			assertEquals( 1, backend.getObjectRegistry().size() );
			assertEquals( 5, relay.add( 5 ) );
			assertEquals( 12, relay.add( 7 ) );

			// Concurrent nested calls
			List<Future<?>> futures = new ArrayList<>();
			for( int t = 0; t < 4; t++ ) {
				futures.add( executor.submit( () -> {
					for( int i = 0; i < 10; i++ ) {
						relay.add( 1 );
					}
					return null;
				} ) );
			}
			for( Future<?> future : futures ) {
				future.get( 30, TimeUnit.SECONDS );
			}
			assertEquals( 53, relay.add( 1 ) );
		}
		finally {
			backend.close();
		}
	}


	@Test
	public void testCompression() throws Exception {
		driver.shutdown();
		driver = NettyConduitDriver.newBuilder()
			.compression( true )
			.build();

		Endpoint endpoint = Endpoint.inproc( "netty-compressed" );
		server = bind( endpoint, SocketType.ROUTER );
		ClientSession client = connect( endpoint, SocketType.DEALER );

		StringBuilder buf = new StringBuilder();
		for( int i = 0; i < 10000; i++ ) {
			buf.append( "repetitive " );
		}
		String big = buf.toString();

		Echo echo = client.create( Echo.class );
		assertEquals( big, echo.echo( big ) );
		checkCounter( client );
	}


	@Test
	public void testSeparatePeers() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-peers" );
		server = bind( endpoint, SocketType.ROUTER );

		ClientSession first = connect( endpoint, SocketType.DEALER );
		ClientSession second = connect( endpoint, SocketType.DEALER );

		Counter first_counter = first.create( Counter.class );
		Counter second_counter = second.create( Counter.class );
		first_counter.add( 10 );
		second_counter.add( 20 );

		int first_id = Conduit.getObjectID( first_counter );
		int second_id = Conduit.getObjectID( second_counter );
		assertNotEquals( first_id, second_id );

		// Closing one peer only cleans up what it owned
		first.close();
		waitFor( () -> !server.getObjectRegistry().contains( first_id ) );
		assertTrue( server.getObjectRegistry().contains( second_id ) );
		assertEquals( 21, second_counter.add( 1 ) );
	}


	@Test
	public void testLinkLossAndReconnect() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-reconnect" );
		server = bind( endpoint, SocketType.ROUTER );

		ConnectionListener listener = mock( ConnectionListener.class );
		ClientSession client = ClientSession.newBuilder()
			.driver( driver )
			.endpoint( endpoint )
			.functions( functions() )
			.connectionListener( listener )
			.connect();
		clients.add( client );

		Counter counter = client.create( Counter.class );
		counter.add( 5 );
		verify( listener, timeout( 2000 ) ).connectionOpened( endpoint );

		server.close();
		verify( listener, timeout( 2000 ) ).connectionLost( endpoint );
		assertFalse( client.isConnected() );
		assertThrows( SessionClosedException.class, counter::get );

		// The session survives and picks up the new server once it appears
		server = bind( endpoint, SocketType.ROUTER );
		verify( listener, timeout( 5000 ).times( 2 ) ).connectionOpened( endpoint );
		waitFor( client::isConnected );

		Counter fresh = client.create( Counter.class );
		assertEquals( 3, fresh.add( 3 ) );
	}


	@Test
	public void testServerCloseFailsPendingCalls() throws Exception {
		Endpoint endpoint = Endpoint.inproc( "netty-pending" );
		server = bind( endpoint, SocketType.ROUTER );
		ClientSession client = connect( endpoint, SocketType.DEALER );

		Echo echo = client.create( Echo.class );
		Future<?> result = executor.submit( () -> {
			echo.sleep( 10000 );
			return null;
		} );
		waitFor( () -> EchoImpl.SLEEPING.get() > 0 );

		server.close();
		try {
			result.get( 10, TimeUnit.SECONDS );
			fail( "Shouldn't have worked" );
		}
		catch( ExecutionException ex ) {
			assertTrue( ex.getCause() instanceof SessionClosedException, ex.toString() );
		}
	}


	private void checkCounter( ClientSession client ) throws IOException {
		Counter counter = client.create( Counter.class );
		assertEquals( 5, counter.add( 5 ) );
		assertEquals( 8, counter.add( 3 ) );
		assertEquals( 8, counter.get() );

		Counter other = client.create( Counter.class );
		assertEquals( 1, other.add( 1 ) );
		assertEquals( 8, counter.get() );

		assertTrue( Conduit.destroy( other ) );
	}


	private ServerSession bind( Endpoint endpoint, SocketType type ) throws IOException {
		return bind( endpoint, type, functions() );
	}


	private ServerSession bind( Endpoint endpoint, SocketType type,
		FunctionRegistry functions ) throws IOException {

		return ServerSession.newBuilder()
			.driver( driver )
			.endpoint( endpoint )
			.socketType( type )
			.functions( functions )
			.workerThreads( 4 )
			.bind();
	}


	private ClientSession connect( Endpoint endpoint, SocketType type )
		throws IOException {

		return connect( endpoint, type, functions() );
	}


	private ClientSession connect( Endpoint endpoint, SocketType type,
		FunctionRegistry functions ) throws IOException {

		ClientSession client = ClientSession.newBuilder()
			.driver( driver )
			.endpoint( endpoint )
			.socketType( type )
			.functions( functions )
			.defaultTimeout( 20, TimeUnit.SECONDS )
			.connect();
		clients.add( client );
		return client;
	}


	private static FunctionRegistry functions() {
		FunctionRegistry functions = new FunctionRegistry();
		functions.register( COUNTER_TYPE, ECHO_TYPE );
		return functions;
	}


	private static void waitFor( BooleanSupplier condition ) throws InterruptedException {
		long deadline = System.currentTimeMillis() + 10000;
		while( !condition.getAsBoolean() ) {
			assertTrue( System.currentTimeMillis() < deadline, "Timed out waiting" );
			Thread.sleep( 20 );
		}
	}



	public interface Counter {
		int add( int delta );

		int get();
	}

	public static class CounterImpl implements Counter {
		private final AtomicInteger value = new AtomicInteger();

		@Override
		public int add( int delta ) {
			return value.addAndGet( delta );
		}

		@Override
		public int get() {
			return value.get();
		}
	}


	public interface Echo {
		String echo( String value );

		void sleep( long millis ) throws InterruptedException;
	}

	public static class EchoImpl implements Echo {
		static final AtomicInteger SLEEPING = new AtomicInteger();

		@Override
		public String echo( String value ) {
			return value;
		}

		@Override
		public void sleep( long millis ) throws InterruptedException {
			SLEEPING.incrementAndGet();
			try {
				Thread.sleep( millis );
			}
			finally {
				SLEEPING.decrementAndGet();
			}
		}
	}


	public interface Relay {
		int add( int delta );
	}

	public static class RelayImpl implements Relay {
		private final Counter backend;

		RelayImpl( Counter backend ) {
			this.backend = backend;
		}

		@Override
		public int add( int delta ) {
			return backend.add( delta );
		}
	}
}
