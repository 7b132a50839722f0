package com.starlight.conduit.driver.netty;

import com.starlight.conduit.Envelope;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;


public class NettyEnvelopeCodecTest {
	@Test
	public void testEncodeLayout() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeEncoder() );
		assertTrue( channel.writeOutbound(
			Envelope.of( new byte[] { 1, 2 }, new byte[ 0 ], new byte[] { 3 } ) ) );

		ByteBuf buffer = channel.readOutbound();
		try {
			// length, part count, then each part
			assertEquals( 4 + 4 + 2 + 4 + 0 + 4 + 1, buffer.readInt() );
			assertEquals( 3, buffer.readInt() );
			assertEquals( 2, buffer.readInt() );
			assertEquals( 1, buffer.readByte() );
			assertEquals( 2, buffer.readByte() );
			assertEquals( 0, buffer.readInt() );
			assertEquals( 1, buffer.readInt() );
			assertEquals( 3, buffer.readByte() );
			assertFalse( buffer.isReadable() );
		}
		finally {
			buffer.release();
		}
		assertFalse( channel.finish() );
	}


	@Test
	public void testHeartbeat() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeEncoder(),
			new NettyEnvelopeDecoder( 1024 ) );

		channel.writeOutbound( new Envelope() );
		ByteBuf buffer = channel.readOutbound();
		assertEquals( 8, buffer.readableBytes() );

		channel.writeInbound( buffer );
		Envelope envelope = channel.readInbound();
		assertTrue( envelope.isEmpty() );
	}


	@Test
	public void testFragmentedFrames() {
		byte[] first = "counter::add".getBytes( StandardCharsets.UTF_8 );
		byte[] second = new byte[ 300 ];
		for( int i = 0; i < second.length; i++ ) {
			second[ i ] = ( byte ) i;
		}

		EmbeddedChannel encoder = new EmbeddedChannel( new NettyEnvelopeEncoder() );
		encoder.writeOutbound( Envelope.of( first, second ) );
		encoder.writeOutbound( Envelope.of( second ) );

		ByteBuf all = Unpooled.buffer();
		ByteBuf buffer;
		while( ( buffer = encoder.readOutbound() ) != null ) {
			all.writeBytes( buffer );
			buffer.release();
		}

		// Deliver a few bytes at a time
		EmbeddedChannel decoder = new EmbeddedChannel( new NettyEnvelopeDecoder( 1024 ) );
		while( all.isReadable() ) {
			decoder.writeInbound( all.readRetainedSlice( Math.min( 7, all.readableBytes() ) ) );
		}
		all.release();

		Envelope envelope = decoder.readInbound();
		assertEquals( 2, envelope.size() );
		assertArrayEquals( first, envelope.get( 0 ) );
		assertArrayEquals( second, envelope.get( 1 ) );

		envelope = decoder.readInbound();
		assertEquals( 1, envelope.size() );
		assertArrayEquals( second, envelope.get( 0 ) );

		assertNull( decoder.readInbound() );
	}


	@Test
	public void testTooLong() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeDecoder( 16 ) );

		ByteBuf buffer = Unpooled.buffer();
		buffer.writeInt( 17 );
		buffer.writeInt( 1 );

		assertThrows( TooLongFrameException.class, () -> channel.writeInbound( buffer ) );
	}


	@Test
	public void testBadPartLength() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeDecoder( 1024 ) );

		ByteBuf buffer = Unpooled.buffer();
		buffer.writeInt( 12 );
		buffer.writeInt( 1 );      // one part...
		buffer.writeInt( 100 );    // ...longer than the frame
		buffer.writeInt( 0 );

		assertThrows( CorruptedFrameException.class, () -> channel.writeInbound( buffer ) );
	}


	@Test
	public void testNegativePartCount() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeDecoder( 1024 ) );

		ByteBuf buffer = Unpooled.buffer();
		buffer.writeInt( 4 );
		buffer.writeInt( -1 );

		assertThrows( CorruptedFrameException.class, () -> channel.writeInbound( buffer ) );
	}


	@Test
	public void testTrailingData() {
		EmbeddedChannel channel = new EmbeddedChannel( new NettyEnvelopeDecoder( 1024 ) );

		ByteBuf buffer = Unpooled.buffer();
		buffer.writeInt( 5 );
		buffer.writeInt( 0 );      // no parts...
		buffer.writeByte( 1 );     // ...but more data

		assertThrows( CorruptedFrameException.class, () -> channel.writeInbound( buffer ) );
	}
}
