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
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Last handler in every pipeline: sends heartbeats when the link is idle, closes links
 * that go silent and passes link events and envelopes to the owning socket.
 */
class LinkHandler extends SimpleChannelInboundHandler<Envelope> {
	private static final Logger LOG = LoggerFactory.getLogger( LinkHandler.class );

	private static final Envelope HEARTBEAT = new Envelope();


	/**
	 * Receives events for the links of one socket.
	 */
	interface LinkListener {
		void linkActive( Channel channel );

		void linkInactive( Channel channel );

		void envelopeReceived( Channel channel, Envelope envelope );
	}


	private final LinkListener listener;


	LinkHandler( LinkListener listener ) {
		this.listener = listener;
	}


	@Override
	public void channelActive( ChannelHandlerContext ctx ) throws Exception {
		listener.linkActive( ctx.channel() );
		super.channelActive( ctx );
	}


	@Override
	public void channelInactive( ChannelHandlerContext ctx ) throws Exception {
		listener.linkInactive( ctx.channel() );
		super.channelInactive( ctx );
	}


	@Override
	protected void channelRead0( ChannelHandlerContext ctx, Envelope envelope ) {
		// Heartbeats only reset the idle timers
		if ( envelope.isEmpty() ) return;

		listener.envelopeReceived( ctx.channel(), envelope );
	}


	@Override
	public void userEventTriggered( ChannelHandlerContext ctx, Object event )
		throws Exception {

		if ( !( event instanceof IdleStateEvent ) ) {
			super.userEventTriggered( ctx, event );
			return;
		}

		IdleState state = ( ( IdleStateEvent ) event ).state();
		if ( state == IdleState.WRITER_IDLE ) {
			ctx.writeAndFlush( HEARTBEAT )
				.addListener( ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE );
		}
		else if ( state == IdleState.READER_IDLE ) {
			LOG.info( "Closing silent link: {}", ctx.channel() );
			ctx.close();
		}
	}


	@Override
	public void exceptionCaught( ChannelHandlerContext ctx, Throwable cause ) {
		// Make sure unexpected errors are printed
		if ( cause instanceof RuntimeException || cause instanceof Error ) {
			LOG.warn( "Unexpected exception on {}, closing", ctx.channel(), cause );
		}
		else LOG.debug( "Exception on {}, closing", ctx.channel(), cause );

		ctx.close();
	}
}
