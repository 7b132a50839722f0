package com.starlight.conduit;

import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;


public class EnvelopeTest {
	private static final byte[] A = { 1 };
	private static final byte[] B = { 2, 2 };
	private static final byte[] C = { 3, 3, 3 };


	@Test
	public void testPushAndPop() {
		Envelope envelope = new Envelope();
		assertTrue( envelope.isEmpty() );

		envelope.pushBack( B ).pushBack( C ).pushFront( A );
		assertEquals( 3, envelope.size() );
		assertEquals( 6, envelope.byteCount() );

		assertSame( A, envelope.peekFront() );
		assertSame( B, envelope.get( 1 ) );
		assertSame( C, envelope.get( 2 ) );

		assertSame( C, envelope.popBack() );
		assertSame( A, envelope.popFront() );
		assertSame( B, envelope.popFront() );
		assertTrue( envelope.isEmpty() );
		assertNull( envelope.peekFront() );
	}


	@Test
	public void testPopEmpty() {
		Envelope envelope = new Envelope();
		assertThrows( NoSuchElementException.class, envelope::popFront );
		assertThrows( NoSuchElementException.class, envelope::popBack );
	}


	@Test
	public void testGetOutOfRange() {
		Envelope envelope = Envelope.of( A, B );
		assertThrows( IndexOutOfBoundsException.class, () -> envelope.get( 2 ) );
		assertThrows( IndexOutOfBoundsException.class, () -> envelope.get( -1 ) );
	}


	@Test
	public void testEmptyPartsArePreserved() {
		Envelope envelope = Envelope.of( new byte[ 0 ], A, new byte[ 0 ] );
		assertEquals( 3, envelope.size() );
		assertEquals( 1, envelope.byteCount() );
		assertEquals( 0, envelope.popBack().length );
	}


	@Test
	public void testNullPartRejected() {
		assertThrows( NullPointerException.class, () -> new Envelope().pushBack( null ) );
		assertThrows( NullPointerException.class, () -> new Envelope().pushFront( null ) );
	}


	@Test
	public void testCopyIsIndependent() {
		Envelope original = Envelope.of( A, B );
		Envelope copy = original.copy();

		copy.popFront();
		copy.pushBack( C );

		assertEquals( 2, original.size() );
		assertSame( A, original.peekFront() );
		assertSame( B, copy.peekFront() );
		assertSame( C, copy.get( 1 ) );
	}


	@Test
	public void testPartsSnapshot() {
		Envelope envelope = Envelope.of( A, B );
		List<byte[]> parts = envelope.parts();

		envelope.pushBack( C );
		assertEquals( 2, parts.size() );
		assertThrows( UnsupportedOperationException.class, () -> parts.add( C ) );
	}


	@Test
	public void testIteratorIsReadOnly() {
		Envelope envelope = Envelope.of( A, B );
		Iterator<byte[]> it = envelope.iterator();
		assertSame( A, it.next() );
		assertThrows( UnsupportedOperationException.class, it::remove );
	}


	@Test
	public void testToString() {
		assertEquals( "Envelope[1, 2, 3]", Envelope.of( A, B, C ).toString() );
		assertEquals( "Envelope[]", new Envelope().toString() );
	}


	@Test
	public void testFrames() {
		for( int value : new int[] { 0, 1, -1, 255, 256, Integer.MAX_VALUE,
			Integer.MIN_VALUE } ) {

			byte[] frame = Frames.intFrame( value );
			assertEquals( Frames.INT_FRAME_SIZE, frame.length );
			assertEquals( value, Frames.readInt( frame ) );
		}

		// Big-endian
		assertArrayEquals( new byte[] { 0, 0, 1, 2 }, Frames.intFrame( 258 ) );

		assertEquals( "counter::add", Frames.readString(
			Frames.stringFrame( "counter::add" ) ) );
		assertEquals( "été", Frames.readString( Frames.stringFrame( "été" ) ) );
	}


	@Test
	public void testBadIntFrame() {
		try {
			Frames.readInt( new byte[ 3 ] );
			fail( "Shouldn't have worked" );
		}
		catch( IllegalArgumentException ex ) {
			// expected
		}
	}
}
