package com.starlight.conduit;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;


/**
 * Exported types shared by the session tests.
 */
public class TestServices {
	static final ExportedType<Counter> COUNTER_TYPE =
		ExportedType.newBuilder( "counter", Counter.class )
			.constructor( args -> new CounterImpl(
				args.length == 0 ? 0 : ( ( Integer ) args[ 0 ] ).intValue() ) )
			.build();

	// No constructor: instances are exported by the server
	static final ExportedType<Echo> ECHO_TYPE =
		ExportedType.newBuilder( "echo", Echo.class ).build();

	static final ExportedType<Thrower> THROWER_TYPE =
		ExportedType.newBuilder( "thrower", Thrower.class )
			.constructor( args -> new ThrowerImpl() )
			.build();

	static final ExportedType<Blocker> BLOCKER_TYPE =
		ExportedType.newBuilder( "blocker", Blocker.class ).build();


	// Construction waits for the gate to open
	static final ExportedType<Gate> GATE_TYPE =
		ExportedType.newBuilder( "gate", Gate.class )
			.constructor( args -> GateImpl.construct() )
			.build();


	static final ExportedType<Poison> POISON_TYPE =
		ExportedType.newBuilder( "poison", Poison.class )
			.constructor( args -> new PoisonImpl() )
			.build();


	static FunctionRegistry newFunctionRegistry() {
		FunctionRegistry functions = new FunctionRegistry();
		functions.register( COUNTER_TYPE, ECHO_TYPE, THROWER_TYPE, BLOCKER_TYPE,
			GATE_TYPE, POISON_TYPE );
		return functions;
	}



	public interface Counter {
		int add( int delta );

		int get();

		/**
		 * Returns the object itself.
		 */
		Counter self();

		/**
		 * Returns a new object sharing this one's value.
		 */
		Counter share();

		/**
		 * Adds the value of another counter to this one.
		 */
		int addFrom( Counter other );
	}


	public static class CounterImpl implements Counter, AutoCloseable {
		private final AtomicInteger value;
		private volatile boolean closed = false;

		CounterImpl( int initial ) {
			this( new AtomicInteger( initial ) );
		}

		private CounterImpl( AtomicInteger value ) {
			this.value = value;
		}


		@Override
		public int add( int delta ) {
			return value.addAndGet( delta );
		}

		@Override
		public int get() {
			return value.get();
		}

		@Override
		public Counter self() {
			return this;
		}

		@Override
		public Counter share() {
			return new CounterImpl( value );
		}

		@Override
		public int addFrom( Counter other ) {
			return value.addAndGet( other.get() );
		}


		@Override
		public void close() {
			closed = true;
		}

		boolean isClosed() {
			return closed;
		}
	}


	public interface Echo {
		boolean echoBoolean( boolean value );

		byte echoByte( byte value );

		short echoShort( short value );

		char echoChar( char value );

		int echoInt( int value );

		long echoLong( long value );

		float echoFloat( float value );

		double echoDouble( double value );

		String echoString( String value );

		int[] echoIntArray( int[] value );

		List<String> echoList( List<String> value );

		Map<String,Integer> echoMap( Map<String,Integer> value );

		Object[] echoAll( int a, String b, List<Integer> c, double d, Integer e );

		void nothing();
	}


	public static class EchoImpl implements Echo {
		@Override public boolean echoBoolean( boolean value ) { return value; }
		@Override public byte echoByte( byte value ) { return value; }
		@Override public short echoShort( short value ) { return value; }
		@Override public char echoChar( char value ) { return value; }
		@Override public int echoInt( int value ) { return value; }
		@Override public long echoLong( long value ) { return value; }
		@Override public float echoFloat( float value ) { return value; }
		@Override public double echoDouble( double value ) { return value; }
		@Override public String echoString( String value ) { return value; }
		@Override public int[] echoIntArray( int[] value ) { return value; }
		@Override public List<String> echoList( List<String> value ) { return value; }

		@Override
		public Map<String,Integer> echoMap( Map<String,Integer> value ) {
			return value;
		}

		@Override
		public Object[] echoAll( int a, String b, List<Integer> c, double d, Integer e ) {
			return new Object[] { Integer.valueOf( a ), b, c, Double.valueOf( d ), e };
		}

		@Override
		public void nothing() {}
	}


	public interface Thrower {
		void throwDeclared( String message ) throws IOException;

		void throwUndeclared( String message );

		void throwRuntime( String message );

		void throwError( String message );
	}


	public static class ThrowerImpl implements Thrower {
		@Override
		public void throwDeclared( String message ) throws IOException {
			throw new IOException( message );
		}

		@Override
		public void throwUndeclared( String message ) {
			ThrowerImpl.<RuntimeException>sneakyThrow( new Exception( message ) );
		}

		@Override
		public void throwRuntime( String message ) {
			throw new IllegalArgumentException( message );
		}

		@Override
		public void throwError( String message ) {
			throw new InternalError( message );
		}


		@SuppressWarnings( "unchecked" )
		private static <E extends Throwable> void sneakyThrow( Throwable t ) throws E {
			throw ( E ) t;
		}
	}


	public interface Blocker {
		/**
		 * Blocks until released or the timeout passes.
		 *
		 * @return		True if released.
		 */
		boolean block( long timeout_ms );
	}


	public static class BlockerImpl implements Blocker {
		private final CountDownLatch entered = new CountDownLatch( 1 );
		private final CountDownLatch release = new CountDownLatch( 1 );

		@Override
		public boolean block( long timeout_ms ) {
			entered.countDown();
			try {
				return release.await( timeout_ms, TimeUnit.MILLISECONDS );
			}
			catch( InterruptedException ex ) {
				return false;
			}
		}


		boolean awaitEntered( long timeout_ms ) throws InterruptedException {
			return entered.await( timeout_ms, TimeUnit.MILLISECONDS );
		}

		void release() {
			release.countDown();
		}
	}


	public interface Gate {
		boolean isOpen();
	}


	public static class GateImpl implements Gate {
		private static volatile CountDownLatch constructing = new CountDownLatch( 1 );
		private static volatile CountDownLatch open = new CountDownLatch( 1 );

		static void reset() {
			constructing = new CountDownLatch( 1 );
			open = new CountDownLatch( 1 );
		}

		static GateImpl construct() {
			constructing.countDown();
			try {
				open.await( 10, TimeUnit.SECONDS );
			}
			catch( InterruptedException ex ) {
				Thread.currentThread().interrupt();
			}
			return new GateImpl();
		}

		static boolean awaitConstructing( long timeout_ms ) throws InterruptedException {
			return constructing.await( timeout_ms, TimeUnit.MILLISECONDS );
		}

		static void openGate() {
			open.countDown();
		}


		@Override
		public boolean isOpen() {
			return open.getCount() == 0;
		}
	}


	/**
	 * Produces values that blow up while being written.
	 */
	public interface Poison {
		Object value();

		void raise();
	}


	public static class PoisonImpl implements Poison {
		@Override
		public Object value() {
			return new Unwritable();
		}

		@Override
		public void raise() {
			throw new UnwritableException();
		}
	}


	public static class Unwritable implements Serializable {
		private static final long serialVersionUID = 0L;

		private void writeObject( ObjectOutputStream out ) throws IOException {
			throw new StackOverflowError( "Nested too deeply" );
		}
	}


	public static class UnwritableException extends RuntimeException {
		private static final long serialVersionUID = 0L;

		private void writeObject( ObjectOutputStream out ) throws IOException {
			throw new StackOverflowError( "Nested too deeply" );
		}
	}
}
