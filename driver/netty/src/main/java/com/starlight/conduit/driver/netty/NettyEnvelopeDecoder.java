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
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;


/**
 * Reads envelopes written by {@link NettyEnvelopeEncoder}. Heartbeats are passed on as
 * empty envelopes.
 */
class NettyEnvelopeDecoder extends ByteToMessageDecoder {
	private final int max_frame_size;


	NettyEnvelopeDecoder( int max_frame_size ) {
		this.max_frame_size = max_frame_size;
	}


	@Override
	protected void decode( ChannelHandlerContext ctx, ByteBuf in, List<Object> out ) {
		if ( in.readableBytes() < 4 ) return;

		final int length = in.getInt( in.readerIndex() );
		if ( length < 4 ) {
			in.skipBytes( in.readableBytes() );
			throw new CorruptedFrameException( "Invalid frame length: " + length );
		}
		if ( length > max_frame_size ) {
			in.skipBytes( in.readableBytes() );
			throw new TooLongFrameException( "Frame length " + length +
				" exceeds maximum of " + max_frame_size );
		}

		// Wait for the full frame
		if ( in.readableBytes() < length + 4 ) return;

		in.skipBytes( 4 );
		final int frame_end = in.readerIndex() + length;

		int part_count = in.readInt();
		if ( part_count < 0 ) {
			in.readerIndex( frame_end );
			throw new CorruptedFrameException( "Invalid part count: " + part_count );
		}

		Envelope envelope = new Envelope();
		for( int i = 0; i < part_count; i++ ) {
			int remaining = frame_end - in.readerIndex();
			int part_length = remaining < 4 ? -1 : in.readInt();
			if ( part_length < 0 || part_length > remaining - 4 ) {
				in.readerIndex( frame_end );
				throw new CorruptedFrameException( "Invalid length for part " + i +
					" of " + part_count + ": " + part_length );
			}

			byte[] part = new byte[ part_length ];
			in.readBytes( part );
			envelope.pushBack( part );
		}

		if ( in.readerIndex() != frame_end ) {
			in.readerIndex( frame_end );
			throw new CorruptedFrameException( "Trailing data in frame" );
		}

		out.add( envelope );
	}
}
